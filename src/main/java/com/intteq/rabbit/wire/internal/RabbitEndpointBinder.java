package com.intteq.rabbit.wire.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.rabbit.wire.WireConsumer;
import com.intteq.rabbit.wire.endpoint.EndpointBinder;
import com.intteq.rabbit.wire.endpoint.EndpointSpec;
import com.intteq.rabbit.wire.rabbitmq.RetryInterceptorFactory;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.AcknowledgeMode;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Exchange;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageListener;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.listener.SimpleMessageListenerContainer;
import org.springframework.amqp.rabbit.support.ListenerExecutionFailedException;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.lang.Nullable;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * RabbitMQ implementation of {@link EndpointBinder}.
 *
 * <p>For every endpoint it:
 * <ul>
 *     <li>declares the durable queue (auto-delete as requested by the spec)</li>
 *     <li>declares and binds an exchange named after the routing key, only when consume
 *         topology is enabled</li>
 *     <li>starts a {@link SimpleMessageListenerContainer} with the spec's prefetch and the
 *         retry advice built from its descriptor</li>
 * </ul>
 *
 * <p>This class is the only place listener containers are created; they are stopped on shutdown.
 */
@Slf4j
public class RabbitEndpointBinder implements EndpointBinder, DisposableBean {

    private final ConnectionFactory connectionFactory;
    private final AmqpAdmin admin;
    private final ObjectMapper objectMapper;
    private final RetryInterceptorFactory retryInterceptorFactory;

    /** Optional Micrometer registry (null-safe). */
    @Nullable
    private final MeterRegistry meterRegistry;

    /** Active listener containers keyed by queue name. */
    private final Map<String, SimpleMessageListenerContainer> containers = new ConcurrentHashMap<>();

    public RabbitEndpointBinder(ConnectionFactory connectionFactory,
                                AmqpAdmin admin,
                                ObjectMapper objectMapper,
                                RetryInterceptorFactory retryInterceptorFactory,
                                @Nullable MeterRegistry meterRegistry) {
        this.connectionFactory = connectionFactory;
        this.admin = admin;
        this.objectMapper = objectMapper;
        this.retryInterceptorFactory = retryInterceptorFactory;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void bind(EndpointSpec spec, WireConsumer<?> consumer) {
        declareTopology(spec);

        containers.computeIfAbsent(spec.getQueueName(), queueName -> {
            SimpleMessageListenerContainer container = createContainer(spec, consumer);
            startContainer(container);

            log.info("RabbitMQ listener started → queue={} prefetch={} retries={}",
                    queueName, spec.getPrefetchCount(), spec.getRetry().totalAttempts());
            return container;
        });
    }

    // =====================================================================
    // TOPOLOGY
    // =====================================================================

    void declareTopology(EndpointSpec spec) {
        QueueBuilder queueBuilder = QueueBuilder.durable(spec.getQueueName());
        if (spec.isAutoDelete()) {
            queueBuilder.autoDelete();
        }
        Queue queue = queueBuilder.build();
        admin.declareQueue(queue);

        if (!spec.isConfigureConsumeTopology()) {
            return;
        }

        Exchange exchange = spec.getExchangeKind().toExchange(spec.getRoutingKey(), false);
        Binding binding = BindingBuilder.bind(queue)
                .to(exchange)
                .with(spec.getRoutingKey())
                .noargs();

        admin.declareExchange(exchange);
        admin.declareBinding(binding);

        log.info("Consume topology declared → exchange={} type={} queue={}",
                exchange.getName(), exchange.getType(), spec.getQueueName());
    }

    // =====================================================================
    // CONTAINERS
    // =====================================================================

    SimpleMessageListenerContainer createContainer(EndpointSpec spec, WireConsumer<?> consumer) {
        String queueName = spec.getQueueName();

        SimpleMessageListenerContainer container = new SimpleMessageListenerContainer(connectionFactory);
        container.setQueueNames(queueName);
        container.setAcknowledgeMode(AcknowledgeMode.AUTO);
        container.setPrefetchCount(spec.getPrefetchCount());
        container.setMissingQueuesFatal(false);
        container.setRecoveryInterval(3000);
        container.setDefaultRequeueRejected(false);
        container.setAdviceChain(retryInterceptorFactory.create(queueName, spec.getRetry()));
        container.setMessageListener(listenerFor(queueName, consumer));
        return container;
    }

    protected void startContainer(SimpleMessageListenerContainer container) {
        container.afterPropertiesSet();
        container.start();
    }

    MessageListener listenerFor(String queueName, WireConsumer<?> consumer) {
        return message -> {
            long start = System.nanoTime();
            try {
                dispatch(consumer, message);
                recordSuccess(queueName, System.nanoTime() - start);
            } catch (Exception ex) {
                recordFailure(queueName);
                throw new ListenerExecutionFailedException(
                        "Consumer " + consumer.identity() + " failed on queue " + queueName, ex, message);
            }
        };
    }

    private <T> void dispatch(WireConsumer<T> consumer, Message message) throws Exception {
        T payload = objectMapper.readValue(message.getBody(), consumer.messageType());
        consumer.handle(payload);
    }

    // =====================================================================
    // METRICS
    // =====================================================================

    private void recordSuccess(String queue, long durationNs) {
        if (meterRegistry == null) return;

        meterRegistry.timer("rabbit-wire.consume.latency", "queue", queue)
                .record(durationNs, TimeUnit.NANOSECONDS);
        meterRegistry.counter("rabbit-wire.consume.success", "queue", queue).increment();
    }

    private void recordFailure(String queue) {
        if (meterRegistry == null) return;

        meterRegistry.counter("rabbit-wire.consume.failure", "queue", queue).increment();
    }

    // =====================================================================
    // SHUTDOWN
    // =====================================================================

    @Override
    public void destroy() {
        log.info("Stopping RabbitMQ listener containers...");

        containers.forEach((queue, container) -> {
            try {
                container.stop();
                container.destroy();
                log.info("Stopped RabbitMQ listener → queue={}", queue);
            } catch (Exception e) {
                log.warn("Failed to stop RabbitMQ listener → queue={}", queue, e);
            }
        });

        containers.clear();
    }
}
