package com.intteq.rabbit.wire.retry;

/**
 * Receives retry events of consumer endpoints.
 */
public interface RetryReporter {

    /**
     * A delivery attempt failed and will be retried.
     *
     * @param attempt 1-based number of the failed attempt
     */
    void attemptFailed(String queueName, int attempt, Throwable error);

    /**
     * No retries are left; the message is about to be rejected.
     */
    void retriesExhausted(String queueName, int attempts, Throwable error);

    /**
     * The failure is neither exempt nor handled by the retry policy (an {@link Error}, for
     * instance); the message is rejected without any retry.
     */
    void notRetried(String queueName, Throwable error);

    /**
     * The failure is exempt from retry and is propagated as is.
     */
    void exempted(String queueName, Throwable error);
}
