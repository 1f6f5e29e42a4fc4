package com.intteq.rabbit.wire.retry;

import org.springframework.amqp.rabbit.support.ConsumerCancelledException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the retry descriptor attached to every receive endpoint.
 *
 * <p>Failed deliveries are retried in two stages:
 * <ol>
 *     <li>{@code limit} attempts spaced by {@code interval} (skipped when {@code limit == 0})</li>
 *     <li>3 exponential attempts: 5s, then +10s increments, capped at 1h</li>
 * </ol>
 *
 * <p>Only the first stage is configurable. {@link ConsumerCancelledException} is always
 * exempt; every other {@link Exception} is retried unless exempted by the caller.
 */
public class RetryPolicyBuilder {

    public static final int DEFAULT_RETRY_LIMIT = 3;
    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(3);

    public static final int EXPONENTIAL_ATTEMPTS = 3;
    public static final Duration EXPONENTIAL_MIN_DELAY = Duration.ofSeconds(5);
    public static final Duration EXPONENTIAL_MAX_DELAY = Duration.ofHours(1);
    public static final Duration EXPONENTIAL_INCREMENT = Duration.ofSeconds(10);

    public RetryDescriptor buildDefault() {
        return build(DEFAULT_RETRY_LIMIT, DEFAULT_INTERVAL, Set.of());
    }

    /**
     * @param limit      attempts of the interval stage, {@code 0} to skip it
     * @param interval   spacing of the interval stage; may be null when {@code limit == 0}
     * @param exemptions exception types that are never retried
     */
    public RetryDescriptor build(int limit, Duration interval, Collection<Class<? extends Throwable>> exemptions) {
        if (limit < 0) {
            throw new IllegalArgumentException("Retry limit must not be negative, was " + limit);
        }
        if (limit > 0 && (interval == null || interval.isNegative() || interval.isZero())) {
            throw new IllegalArgumentException("Retry interval must be positive, was " + interval);
        }

        List<RetryStage> stages = new ArrayList<>();
        if (limit > 0) {
            stages.add(RetryStage.interval(limit, interval));
        }
        stages.add(RetryStage.exponential(
                EXPONENTIAL_ATTEMPTS, EXPONENTIAL_MIN_DELAY, EXPONENTIAL_MAX_DELAY, EXPONENTIAL_INCREMENT));

        Set<Class<? extends Throwable>> exempt = new LinkedHashSet<>();
        exempt.add(ConsumerCancelledException.class);
        if (exemptions != null) {
            exempt.addAll(exemptions);
        }

        return new RetryDescriptor(stages, exempt, Set.of(Exception.class));
    }
}
