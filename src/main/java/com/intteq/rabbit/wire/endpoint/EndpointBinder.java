package com.intteq.rabbit.wire.endpoint;

import com.intteq.rabbit.wire.WireConsumer;

/**
 * Callback that binds a consumer to the queue described by an {@link EndpointSpec}.
 * Implemented by the transport.
 */
@FunctionalInterface
public interface EndpointBinder {

    void bind(EndpointSpec spec, WireConsumer<?> consumer);
}
