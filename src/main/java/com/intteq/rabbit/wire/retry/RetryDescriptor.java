package com.intteq.rabbit.wire.retry;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.springframework.util.Assert;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered retry stages plus the exception types that are exempt from retry and the
 * ones that are handled by it.
 *
 * <p>Exception checks walk the cause chain, because listener containers wrap handler
 * failures. An exempt type anywhere in the chain wins over a handled one.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RetryDescriptor {

    private final List<RetryStage> stages;
    private final Set<Class<? extends Throwable>> exempt;
    private final Set<Class<? extends Throwable>> handled;

    public RetryDescriptor(List<RetryStage> stages,
                           Collection<Class<? extends Throwable>> exempt,
                           Collection<Class<? extends Throwable>> handled) {
        Assert.notNull(stages, "stages must not be null");
        Assert.noNullElements(stages, "stages must not contain null");
        Assert.notNull(exempt, "exempt must not be null");
        Assert.notNull(handled, "handled must not be null");

        for (Class<? extends Throwable> type : exempt) {
            if (handled.contains(type)) {
                throw new IllegalArgumentException(
                        type.getName() + " cannot be both exempt from retry and handled by it");
            }
        }

        this.stages = List.copyOf(stages);
        this.exempt = Collections.unmodifiableSet(new LinkedHashSet<>(exempt));
        this.handled = Collections.unmodifiableSet(new LinkedHashSet<>(handled));
    }

    /**
     * Number of retries across all stages (the first delivery is not counted).
     */
    public int totalAttempts() {
        return stages.stream().mapToInt(RetryStage::getAttempts).sum();
    }

    /**
     * Delay before the n-th retry, or empty once every stage is used up.
     *
     * @param retryNumber 1-based retry number
     */
    public Optional<Duration> delayBeforeRetry(int retryNumber) {
        if (retryNumber < 1) {
            return Optional.empty();
        }
        int remaining = retryNumber - 1;
        for (RetryStage stage : stages) {
            if (remaining < stage.getAttempts()) {
                return Optional.of(stage.delayFor(remaining));
            }
            remaining -= stage.getAttempts();
        }
        return Optional.empty();
    }

    /**
     * Full retry schedule, one delay per retry.
     */
    public List<Duration> schedule() {
        List<Duration> delays = new ArrayList<>();
        for (RetryStage stage : stages) {
            for (int i = 0; i < stage.getAttempts(); i++) {
                delays.add(stage.delayFor(i));
            }
        }
        return delays;
    }

    public boolean isExempt(Throwable error) {
        return matches(error, exempt);
    }

    public boolean isRetryable(Throwable error) {
        return !isExempt(error) && matches(error, handled);
    }

    private static boolean matches(Throwable error, Set<Class<? extends Throwable>> types) {
        Set<Throwable> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Throwable current = error; current != null && visited.add(current); current = current.getCause()) {
            for (Class<? extends Throwable> type : types) {
                if (type.isInstance(current)) {
                    return true;
                }
            }
        }
        return false;
    }
}
