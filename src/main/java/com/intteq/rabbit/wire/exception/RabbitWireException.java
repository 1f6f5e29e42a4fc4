package com.intteq.rabbit.wire.exception;

/**
 * Base type for every error raised by the Rabbit Wire library.
 */
public class RabbitWireException extends RuntimeException {

    public RabbitWireException(String message) {
        super(message);
    }

    public RabbitWireException(String message, Throwable cause) {
        super(message, cause);
    }
}
