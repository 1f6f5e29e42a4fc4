package com.intteq.rabbit.wire.rabbitmq;

import com.intteq.rabbit.wire.retry.RetryDescriptor;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryPolicy;
import org.springframework.retry.context.RetryContextSupport;

/**
 * Spring Retry policy that follows a {@link RetryDescriptor}: retryable failures get up to
 * {@link RetryDescriptor#totalAttempts()} retries, anything else stops at the first failure.
 */
public class DescriptorRetryPolicy implements RetryPolicy {

    private final RetryDescriptor descriptor;

    public DescriptorRetryPolicy(RetryDescriptor descriptor) {
        this.descriptor = descriptor;
    }

    @Override
    public boolean canRetry(RetryContext context) {
        Throwable last = context.getLastThrowable();
        if (last == null) {
            return true;
        }
        return descriptor.isRetryable(last) && context.getRetryCount() <= descriptor.totalAttempts();
    }

    @Override
    public RetryContext open(RetryContext parent) {
        return new RetryContextSupport(parent);
    }

    @Override
    public void close(RetryContext context) {
        // nothing to release
    }

    @Override
    public void registerThrowable(RetryContext context, Throwable throwable) {
        ((RetryContextSupport) context).registerThrowable(throwable);
    }
}
