package com.intteq.rabbit.wire.retry;

import lombok.extern.slf4j.Slf4j;

/**
 * {@link RetryReporter} writing every event to the application log.
 */
@Slf4j
public class LoggingRetryReporter implements RetryReporter {

    @Override
    public void attemptFailed(String queueName, int attempt, Throwable error) {
        log.error("An error occurred on retry (queue={} attempt={}): {}", queueName, attempt, error.getMessage(), error);
    }

    @Override
    public void retriesExhausted(String queueName, int attempts, Throwable error) {
        log.error("Retries exhausted → rejecting message (queue={} attempts={})", queueName, attempts, error);
    }

    @Override
    public void notRetried(String queueName, Throwable error) {
        log.error("Failure not handled by retry → rejecting message (queue={})", queueName, error);
    }

    @Override
    public void exempted(String queueName, Throwable error) {
        log.warn("Failure exempt from retry → propagating (queue={}): {}", queueName, error.getMessage());
    }
}
