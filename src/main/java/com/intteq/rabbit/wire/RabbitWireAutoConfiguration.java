package com.intteq.rabbit.wire;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.rabbit.wire.endpoint.EndpointBinder;
import com.intteq.rabbit.wire.endpoint.EndpointConventions;
import com.intteq.rabbit.wire.endpoint.EndpointRegistrar;
import com.intteq.rabbit.wire.endpoint.QueueNameResolver;
import com.intteq.rabbit.wire.internal.EndpointRegistrationInitializer;
import com.intteq.rabbit.wire.internal.RabbitEndpointBinder;
import com.intteq.rabbit.wire.internal.RabbitMessageGateway;
import com.intteq.rabbit.wire.rabbitmq.RabbitWireTransportConfig;
import com.intteq.rabbit.wire.rabbitmq.RetryInterceptorFactory;
import com.intteq.rabbit.wire.retry.LoggingRetryReporter;
import com.intteq.rabbit.wire.retry.RetryPolicyBuilder;
import com.intteq.rabbit.wire.retry.RetryReporter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.amqp.RabbitAutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.lang.Nullable;
import org.springframework.util.ClassUtils;

import java.util.List;
import java.util.Map;

/**
 * Auto-configuration for Rabbit Wire.
 *
 * <p>Enabled by default; disable it with:
 *
 * <pre>
 *   rabbit-wire.enabled = false
 * </pre>
 *
 * <p>Every {@link WireConsumer} bean gets an endpoint once the context is ready, and a
 * {@link MessageGateway} is exposed for sending. The {@link MeterRegistry} is optional;
 * metrics go to an in-memory registry when the application has none.
 */
@AutoConfiguration(before = RabbitAutoConfiguration.class)
@EnableConfigurationProperties(RabbitWireProperties.class)
@ConditionalOnProperty(prefix = "rabbit-wire", name = "enabled", havingValue = "true", matchIfMissing = true)
@Import(RabbitWireTransportConfig.class)
public class RabbitWireAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public QueueNameResolver queueNameResolver() {
        return new QueueNameResolver();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicyBuilder retryPolicyBuilder() {
        return new RetryPolicyBuilder();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryReporter retryReporter() {
        return new LoggingRetryReporter();
    }

    @Bean
    @ConditionalOnMissingBean
    public EndpointRegistrar endpointRegistrar(QueueNameResolver resolver, RetryPolicyBuilder retryPolicyBuilder) {
        return new EndpointRegistrar(resolver, retryPolicyBuilder);
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryInterceptorFactory retryInterceptorFactory(RetryReporter retryReporter) {
        return new RetryInterceptorFactory(retryReporter);
    }

    /**
     * Send conventions: explicit {@code rabbit-wire.conventions.*} entries first, then the
     * queue of every registered consumer for its message type.
     */
    @Bean
    @ConditionalOnMissingBean
    public EndpointConventions endpointConventions(RabbitWireProperties properties,
                                                   EndpointRegistrar registrar,
                                                   ObjectProvider<WireConsumer<?>> consumers) {

        EndpointConventions.Builder builder = EndpointConventions.builder();

        ClassLoader classLoader = ClassUtils.getDefaultClassLoader();
        for (Map.Entry<String, String> entry : properties.getConventions().entrySet()) {
            try {
                builder.map(ClassUtils.forName(entry.getKey(), classLoader), entry.getValue());
            } catch (ClassNotFoundException | LinkageError e) {
                throw new IllegalStateException(
                        "rabbit-wire.conventions refers to unknown message type " + entry.getKey(), e);
            }
        }

        registrar.plan(consumers.orderedStream().toList(), properties)
                .forEach(planned -> builder.map(
                        planned.getConsumer().messageType(), planned.getSpec().getQueueName()));

        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean(EndpointBinder.class)
    public RabbitEndpointBinder rabbitEndpointBinder(ConnectionFactory connectionFactory,
                                                     AmqpAdmin amqpAdmin,
                                                     @Nullable ObjectMapper objectMapper,
                                                     RetryInterceptorFactory retryInterceptorFactory,
                                                     @Nullable MeterRegistry meterRegistry) {

        ObjectMapper mapper = objectMapper != null ? objectMapper : new ObjectMapper();
        return new RabbitEndpointBinder(connectionFactory, amqpAdmin, mapper, retryInterceptorFactory, meterRegistry);
    }

    @Bean
    public EndpointRegistrationInitializer endpointRegistrationInitializer(EndpointRegistrar registrar,
                                                                           RabbitWireProperties properties,
                                                                           ObjectProvider<WireConsumer<?>> consumers,
                                                                           EndpointBinder binder) {
        List<WireConsumer<?>> ordered = consumers.orderedStream().toList();
        return new EndpointRegistrationInitializer(registrar, properties, ordered, binder);
    }

    @Bean
    @ConditionalOnMissingBean(MessageGateway.class)
    public MessageGateway messageGateway(RabbitTemplate rabbitTemplate,
                                         EndpointConventions conventions,
                                         @Nullable MeterRegistry meterRegistry) {

        MeterRegistry registry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
        return new RabbitMessageGateway(rabbitTemplate, conventions, registry);
    }
}
