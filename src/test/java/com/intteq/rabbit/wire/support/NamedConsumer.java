package com.intteq.rabbit.wire.support;

import com.intteq.rabbit.wire.WireConsumer;

/**
 * Consumer whose identity is chosen by the test.
 */
public class NamedConsumer<T> implements WireConsumer<T> {

    private final String identity;
    private final Class<T> messageType;

    public NamedConsumer(String identity, Class<T> messageType) {
        this.identity = identity;
        this.messageType = messageType;
    }

    @Override
    public String identity() {
        return identity;
    }

    @Override
    public Class<T> messageType() {
        return messageType;
    }

    @Override
    public void handle(T message) {
    }
}
