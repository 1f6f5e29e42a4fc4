package com.intteq.rabbit.wire.exception;

/**
 * Thrown when a message is sent by convention but no destination address was
 * registered for its type at startup.
 */
public class ConventionNotFoundException extends RabbitWireException {

    private final Class<?> messageType;

    public ConventionNotFoundException(Class<?> messageType) {
        super("A convention for the message type " + messageType.getName() + " was not found");
        this.messageType = messageType;
    }

    public Class<?> getMessageType() {
        return messageType;
    }
}
