package com.intteq.rabbit.wire.endpoint;

import com.intteq.rabbit.wire.exception.InvalidIdentifierException;

import java.util.Objects;

/**
 * Maps a consumer type name and an environment prefix to a queue name:
 *
 * <pre>
 *   {prefix}.{lower-cased event name}.v1
 *
 *   resolve("ProductCreatedConsumer", "dev") = "dev.productcreated.event.v1"
 * </pre>
 *
 * <p>Producers and consumers must agree on this name, so resolution is pure and the
 * prefix is used exactly as given.
 */
public class QueueNameResolver {

    public static final String VERSION_SEGMENT = "v1";

    /**
     * @throws InvalidIdentifierException if {@code typeName} is empty or malformed
     */
    public String resolve(String typeName, String prefix) {
        return resolve(ConsumerIdentity.of(typeName), prefix);
    }

    public String resolve(ConsumerIdentity identity, String prefix) {
        Objects.requireNonNull(identity, "identity must not be null");
        Objects.requireNonNull(prefix, "prefix must not be null");
        return prefix + "." + identity.segment() + "." + VERSION_SEGMENT;
    }
}
