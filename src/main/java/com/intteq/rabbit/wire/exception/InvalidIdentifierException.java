package com.intteq.rabbit.wire.exception;

/**
 * Thrown when a consumer type name cannot be turned into a queue name
 * (null, blank, not a Java identifier, or nothing left once the suffix is replaced).
 *
 * <p>Raised at registration time and never retried.
 */
public class InvalidIdentifierException extends RabbitWireException {

    private final String identifier;

    public InvalidIdentifierException(String identifier, String reason) {
        super("Invalid consumer identifier '" + identifier + "': " + reason);
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
