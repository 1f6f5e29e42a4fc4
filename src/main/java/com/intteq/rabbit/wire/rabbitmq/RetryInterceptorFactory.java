package com.intteq.rabbit.wire.rabbitmq;

import com.intteq.rabbit.wire.retry.RetryDescriptor;
import com.intteq.rabbit.wire.retry.RetryReporter;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.config.RetryInterceptorBuilder;
import org.springframework.amqp.rabbit.retry.MessageRecoverer;
import org.springframework.amqp.rabbit.retry.RejectAndDontRequeueRecoverer;
import org.springframework.amqp.rabbit.support.ListenerExecutionFailedException;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.interceptor.RetryOperationsInterceptor;
import org.springframework.retry.support.RetrySynchronizationManager;
import org.springframework.retry.support.RetryTemplate;

/**
 * Turns a {@link RetryDescriptor} into the advice applied around a listener container's
 * message handling.
 *
 * <ul>
 *     <li>Retryable failures are retried on the listener thread following the descriptor's stages</li>
 *     <li>Every failed attempt and the final exhaustion are sent to the {@link RetryReporter}</li>
 *     <li>Exhausted messages are rejected without requeue so the broker can dead-letter them</li>
 *     <li>Exempt failures are reported and rethrown on the first occurrence</li>
 *     <li>Failures the descriptor does not handle are reported separately and rejected at once</li>
 * </ul>
 */
public class RetryInterceptorFactory {

    private final RetryReporter reporter;
    private final Sleeper sleeper;

    public RetryInterceptorFactory(RetryReporter reporter) {
        this(reporter, new ThreadWaitSleeper());
    }

    public RetryInterceptorFactory(RetryReporter reporter, Sleeper sleeper) {
        this.reporter = reporter;
        this.sleeper = sleeper;
    }

    public RetryOperationsInterceptor create(String queueName, RetryDescriptor descriptor) {
        return RetryInterceptorBuilder.stateless()
                .retryOperations(createTemplate(queueName, descriptor))
                .recoverer(createRecoverer(queueName, descriptor))
                .build();
    }

    RetryTemplate createTemplate(String queueName, RetryDescriptor descriptor) {
        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new DescriptorRetryPolicy(descriptor));
        template.setBackOffPolicy(new StagedBackOffPolicy(descriptor, sleeper));
        template.registerListener(new ReportingRetryListener(queueName, descriptor));
        return template;
    }

    MessageRecoverer createRecoverer(String queueName, RetryDescriptor descriptor) {
        return new ReportingRecoverer(queueName, descriptor);
    }

    private final class ReportingRetryListener implements RetryListener {

        private final String queueName;
        private final RetryDescriptor descriptor;

        private ReportingRetryListener(String queueName, RetryDescriptor descriptor) {
            this.queueName = queueName;
            this.descriptor = descriptor;
        }

        @Override
        public <T, E extends Throwable> void onError(RetryContext context,
                                                     RetryCallback<T, E> callback,
                                                     Throwable throwable) {
            if (descriptor.isRetryable(throwable) && context.getRetryCount() <= descriptor.totalAttempts()) {
                reporter.attemptFailed(queueName, context.getRetryCount(), throwable);
            }
        }
    }

    private final class ReportingRecoverer implements MessageRecoverer {

        private final String queueName;
        private final RetryDescriptor descriptor;
        private final MessageRecoverer reject = new RejectAndDontRequeueRecoverer();

        private ReportingRecoverer(String queueName, RetryDescriptor descriptor) {
            this.queueName = queueName;
            this.descriptor = descriptor;
        }

        @Override
        public void recover(Message message, Throwable cause) {
            if (descriptor.isExempt(cause)) {
                reporter.exempted(queueName, cause);
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new ListenerExecutionFailedException("Failure exempt from retry", cause, message);
            }

            if (!descriptor.isRetryable(cause)) {
                reporter.notRetried(queueName, cause);
                reject.recover(message, cause);
                return;
            }

            RetryContext context = RetrySynchronizationManager.getContext();
            int attempts = context != null ? context.getRetryCount() : descriptor.totalAttempts() + 1;
            reporter.retriesExhausted(queueName, attempts, cause);

            reject.recover(message, cause);
        }
    }
}
