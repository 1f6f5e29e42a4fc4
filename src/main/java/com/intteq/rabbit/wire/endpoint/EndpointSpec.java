package com.intteq.rabbit.wire.endpoint;

import com.intteq.rabbit.wire.retry.RetryDescriptor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.springframework.util.Assert;

/**
 * Everything the transport needs to bind one consumer: queue name, routing key,
 * exchange kind, prefetch, topology flags and the retry descriptor.
 *
 * <p>Instances are immutable; use {@link #toBuilder()} to derive a modified copy.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class EndpointSpec {

    private final String queueName;
    private final String routingKey;
    private final ExchangeKind exchangeKind;
    private final int prefetchCount;
    private final boolean configureConsumeTopology;
    private final boolean autoDelete;
    private final RetryDescriptor retry;

    @Builder(toBuilder = true)
    private EndpointSpec(String queueName,
                         String routingKey,
                         ExchangeKind exchangeKind,
                         int prefetchCount,
                         boolean configureConsumeTopology,
                         boolean autoDelete,
                         RetryDescriptor retry) {
        Assert.hasText(queueName, "queueName must not be blank");
        Assert.hasText(routingKey, "routingKey must not be blank");
        Assert.notNull(exchangeKind, "exchangeKind must not be null");
        Assert.isTrue(prefetchCount > 0, "prefetchCount must be positive, was " + prefetchCount);
        Assert.notNull(retry, "retry must not be null");

        this.queueName = queueName;
        this.routingKey = routingKey;
        this.exchangeKind = exchangeKind;
        this.prefetchCount = prefetchCount;
        this.configureConsumeTopology = configureConsumeTopology;
        this.autoDelete = autoDelete;
        this.retry = retry;
    }
}
