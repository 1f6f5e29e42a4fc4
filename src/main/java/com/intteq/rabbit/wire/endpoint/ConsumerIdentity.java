package com.intteq.rabbit.wire.endpoint;

import com.intteq.rabbit.wire.exception.InvalidIdentifierException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Locale;

/**
 * Stable name of a consumer, derived from its declared type name.
 *
 * <p>A trailing {@value #CONSUMER_SUFFIX} is replaced by {@value #EVENT_MARKER}:
 * <pre>
 *   ProductCreatedConsumer → eventName = ProductCreated.event, segment = productcreated.event
 *   AuditTrail             → eventName = AuditTrail,           segment = audittrail
 * </pre>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ConsumerIdentity {

    public static final String CONSUMER_SUFFIX = "Consumer";
    public static final String EVENT_MARKER = ".event";

    private final String typeName;
    private final String eventName;

    private ConsumerIdentity(String typeName, String eventName) {
        this.typeName = typeName;
        this.eventName = eventName;
    }

    /**
     * Derive the identity of a consumer type name.
     *
     * @throws InvalidIdentifierException if the name is empty, not a Java identifier,
     *                                    or consists of the suffix alone
     */
    public static ConsumerIdentity of(String typeName) {
        if (typeName == null || typeName.isBlank()) {
            throw new InvalidIdentifierException(typeName, "type name must not be empty");
        }
        if (!isJavaIdentifier(typeName)) {
            throw new InvalidIdentifierException(typeName, "type name is not a valid identifier");
        }
        if (!typeName.endsWith(CONSUMER_SUFFIX)) {
            return new ConsumerIdentity(typeName, typeName);
        }

        String baseName = typeName.substring(0, typeName.length() - CONSUMER_SUFFIX.length());
        if (baseName.isEmpty()) {
            throw new InvalidIdentifierException(typeName, "nothing left before the '" + CONSUMER_SUFFIX + "' suffix");
        }
        return new ConsumerIdentity(typeName, baseName + EVENT_MARKER);
    }

    /**
     * Lower-cased event name, the middle part of a queue name.
     */
    public String segment() {
        return eventName.toLowerCase(Locale.ROOT);
    }

    private static boolean isJavaIdentifier(String name) {
        if (!Character.isJavaIdentifierStart(name.charAt(0))) {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            if (!Character.isJavaIdentifierPart(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
