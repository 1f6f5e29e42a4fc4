package com.intteq.rabbit.wire.endpoint;

import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.Exchange;
import org.springframework.amqp.core.ExchangeTypes;
import org.springframework.amqp.core.FanoutExchange;
import org.springframework.amqp.core.TopicExchange;

/**
 * Exchange topology used to route messages to an endpoint's queue.
 */
public enum ExchangeKind {

    FANOUT(ExchangeTypes.FANOUT),
    DIRECT(ExchangeTypes.DIRECT),
    TOPIC(ExchangeTypes.TOPIC);

    private final String exchangeType;

    ExchangeKind(String exchangeType) {
        this.exchangeType = exchangeType;
    }

    public String exchangeType() {
        return exchangeType;
    }

    /**
     * Build a durable exchange of this kind.
     */
    public Exchange toExchange(String name, boolean autoDelete) {
        return switch (this) {
            case FANOUT -> new FanoutExchange(name, true, autoDelete);
            case DIRECT -> new DirectExchange(name, true, autoDelete);
            case TOPIC -> new TopicExchange(name, true, autoDelete);
        };
    }
}
