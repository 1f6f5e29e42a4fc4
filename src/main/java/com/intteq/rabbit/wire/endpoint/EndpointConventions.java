package com.intteq.rabbit.wire.endpoint;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.Assert;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only table of message type → destination address, used when a message is sent
 * without an explicit address. Built once at startup.
 *
 * <p>Lookups match the exact message class.
 */
@Slf4j
public final class EndpointConventions {

    private final Map<Class<?>, String> addresses;

    private EndpointConventions(Map<Class<?>, String> addresses) {
        this.addresses = Map.copyOf(addresses);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static EndpointConventions empty() {
        return new EndpointConventions(Map.of());
    }

    public Optional<String> find(Class<?> messageType) {
        return Optional.ofNullable(addresses.get(messageType));
    }

    public Map<Class<?>, String> asMap() {
        return addresses;
    }

    public static final class Builder {

        private final Map<Class<?>, String> addresses = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Map a message type to an address. The first mapping for a type wins.
         */
        public Builder map(Class<?> messageType, String address) {
            Assert.notNull(messageType, "messageType must not be null");
            Assert.hasText(address, "address must not be blank");

            String existing = addresses.putIfAbsent(messageType, address);
            if (existing != null && !existing.equals(address)) {
                log.warn("Convention for {} already points to '{}' → ignoring '{}'",
                        messageType.getName(), existing, address);
            }
            return this;
        }

        public EndpointConventions build() {
            return new EndpointConventions(addresses);
        }
    }
}
