package com.intteq.rabbit.wire.retry;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.springframework.util.Assert;

import java.time.Duration;
import java.util.Optional;

/**
 * One stage of a retry schedule.
 *
 * <ul>
 *     <li>{@link Kind#INTERVAL}: every attempt waits {@code baseDelay}</li>
 *     <li>{@link Kind#EXPONENTIAL}: attempt {@code i} (0-based) waits
 *         {@code min(baseDelay + increment * (2^i - 1), maxDelay)}</li>
 * </ul>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RetryStage {

    public enum Kind {
        INTERVAL,
        EXPONENTIAL
    }

    private static final int MAX_DOUBLINGS = 30;

    private final Kind kind;
    private final int attempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final Duration increment;

    private RetryStage(Kind kind, int attempts, Duration baseDelay, Duration maxDelay, Duration increment) {
        Assert.isTrue(attempts >= 0, "attempts must not be negative, was " + attempts);
        Assert.notNull(baseDelay, "baseDelay must not be null");
        Assert.isTrue(!baseDelay.isNegative(), "baseDelay must not be negative");
        this.kind = kind;
        this.attempts = attempts;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.increment = increment;
    }

    public static RetryStage interval(int attempts, Duration delay) {
        return new RetryStage(Kind.INTERVAL, attempts, delay, null, null);
    }

    public static RetryStage exponential(int attempts, Duration minDelay, Duration maxDelay, Duration increment) {
        Assert.notNull(maxDelay, "maxDelay must not be null");
        Assert.notNull(increment, "increment must not be null");
        Assert.isTrue(maxDelay.compareTo(minDelay) >= 0, "maxDelay must not be shorter than minDelay");
        return new RetryStage(Kind.EXPONENTIAL, attempts, minDelay, maxDelay, increment);
    }

    public Optional<Duration> getMaxDelay() {
        return Optional.ofNullable(maxDelay);
    }

    public Optional<Duration> getIncrement() {
        return Optional.ofNullable(increment);
    }

    /**
     * Delay before the given attempt of this stage.
     *
     * @param attemptIndex 0-based attempt within the stage
     */
    public Duration delayFor(int attemptIndex) {
        Assert.isTrue(attemptIndex >= 0 && attemptIndex < attempts,
                "attemptIndex out of range: " + attemptIndex + " (attempts=" + attempts + ")");

        if (kind == Kind.INTERVAL) {
            return baseDelay;
        }

        long factor = (1L << Math.min(attemptIndex, MAX_DOUBLINGS)) - 1;
        Duration delay = baseDelay.plus(increment.multipliedBy(factor));
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }
}
