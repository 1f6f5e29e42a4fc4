package com.intteq.rabbit.wire;

import com.intteq.rabbit.wire.endpoint.EndpointSpec;
import org.springframework.util.ClassUtils;

import java.util.Set;

/**
 * A handler bound to one queue, processing messages of a single type.
 *
 * <p>Register implementations as beans; the queue name is derived from {@link #identity()}:
 * <pre>
 * {@code
 * @Component
 * public class ProductCreatedConsumer implements WireConsumer<ProductCreated> {
 *
 *     public Class<ProductCreated> messageType() {
 *         return ProductCreated.class;
 *     }
 *
 *     public void handle(ProductCreated message) {
 *         // consumed from "<prefix>.productcreated.event.v1"
 *     }
 * }
 * }
 * </pre>
 *
 * @param <T> message payload type
 */
public interface WireConsumer<T> {

    Class<T> messageType();

    /**
     * Process one message. Any exception is subject to the endpoint's retry policy.
     */
    void handle(T message) throws Exception;

    /**
     * Type name the queue name is derived from. Defaults to the simple name of the
     * user class, so Spring proxies resolve to the same queue as the plain class.
     */
    default String identity() {
        return ClassUtils.getUserClass(this).getSimpleName();
    }

    /**
     * Exception types that must never be retried for this consumer.
     */
    default Set<Class<? extends Throwable>> retryExemptions() {
        return Set.of();
    }

    /**
     * Hook to override the default endpoint attributes (prefetch, exchange kind, ...).
     */
    default void customize(EndpointSpec.EndpointSpecBuilder endpoint) {
    }
}
