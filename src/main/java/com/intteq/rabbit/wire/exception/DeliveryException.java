package com.intteq.rabbit.wire.exception;

/**
 * Exception thrown when the broker could not accept a message: the publish call failed,
 * the broker nacked it, or it was returned as unroutable.
 */
public class DeliveryException extends RabbitWireException {

    private final String address;

    public DeliveryException(String address, String message) {
        super(message);
        this.address = address;
    }

    public DeliveryException(String address, String message, Throwable cause) {
        super(message, cause);
        this.address = address;
    }

    public String getAddress() {
        return address;
    }
}
