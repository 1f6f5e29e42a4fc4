package com.intteq.rabbit.wire.endpoint;

import lombok.Value;

/**
 * Publish target parsed from a send address.
 *
 * <ul>
 *     <li>{@code queue:name} or bare {@code name}: default exchange, routing key = queue name</li>
 *     <li>{@code exchange:name}: the named exchange, empty routing key</li>
 * </ul>
 */
@Value
public class SendAddress {

    private static final String QUEUE_SCHEME = "queue:";
    private static final String EXCHANGE_SCHEME = "exchange:";

    String exchange;
    String routingKey;

    public static SendAddress parse(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Send address must not be blank");
        }
        if (address.startsWith(EXCHANGE_SCHEME)) {
            return new SendAddress(requireName(address, EXCHANGE_SCHEME), "");
        }
        if (address.startsWith(QUEUE_SCHEME)) {
            return new SendAddress("", requireName(address, QUEUE_SCHEME));
        }
        return new SendAddress("", address);
    }

    private static String requireName(String address, String scheme) {
        String name = address.substring(scheme.length());
        if (name.isBlank()) {
            throw new IllegalArgumentException("Send address '" + address + "' has no name after '" + scheme + "'");
        }
        return name;
    }
}
