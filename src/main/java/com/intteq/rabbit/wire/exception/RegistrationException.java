package com.intteq.rabbit.wire.exception;

/**
 * Thrown when endpoint registration has to be aborted, e.g. two different consumers
 * resolve to the same queue name.
 */
public class RegistrationException extends RabbitWireException {

    public RegistrationException(String message) {
        super(message);
    }
}
