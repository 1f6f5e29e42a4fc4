package com.intteq.rabbit.wire.rabbitmq;

import com.intteq.rabbit.wire.retry.RetryDescriptor;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;

import java.time.Duration;

/**
 * Back-off that walks the stages of a {@link RetryDescriptor}: interval delays first,
 * then the exponential ones.
 */
public class StagedBackOffPolicy implements BackOffPolicy {

    private final RetryDescriptor descriptor;
    private final Sleeper sleeper;

    public StagedBackOffPolicy(RetryDescriptor descriptor) {
        this(descriptor, new ThreadWaitSleeper());
    }

    public StagedBackOffPolicy(RetryDescriptor descriptor, Sleeper sleeper) {
        this.descriptor = descriptor;
        this.sleeper = sleeper;
    }

    @Override
    public BackOffContext start(RetryContext context) {
        return new StagedBackOffContext();
    }

    @Override
    public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
        StagedBackOffContext context = (StagedBackOffContext) backOffContext;
        context.retries++;

        Duration delay = descriptor.delayBeforeRetry(context.retries).orElse(Duration.ZERO);
        try {
            sleeper.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackOffInterruptedException("Thread interrupted while backing off", e);
        }
    }

    private static final class StagedBackOffContext implements BackOffContext {
        private int retries;
    }
}
