package com.intteq.rabbit.wire.endpoint;

import com.intteq.rabbit.wire.RabbitWireProperties;
import com.intteq.rabbit.wire.WireConsumer;
import com.intteq.rabbit.wire.exception.InvalidIdentifierException;
import com.intteq.rabbit.wire.exception.RegistrationException;
import com.intteq.rabbit.wire.retry.RetryDescriptor;
import com.intteq.rabbit.wire.retry.RetryPolicyBuilder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.ClassUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives an {@link EndpointSpec} for every consumer and hands it to the transport.
 *
 * <p>Registration is all-or-nothing: every spec is derived and checked before the first
 * {@link EndpointBinder#bind} call. It is meant to run once at startup and is not safe
 * for concurrent invocation.
 */
@Slf4j
@RequiredArgsConstructor
public class EndpointRegistrar {

    private final QueueNameResolver resolver;
    private final RetryPolicyBuilder retryPolicyBuilder;

    /**
     * Bind every consumer, in the given order.
     *
     * @return the specs that were bound
     * @throws InvalidIdentifierException if a consumer identity cannot be resolved
     * @throws RegistrationException      if two consumers resolve to the same queue
     */
    public List<EndpointSpec> register(List<? extends WireConsumer<?>> consumers,
                                       RabbitWireProperties config,
                                       EndpointBinder binder) {

        List<PlannedEndpoint> planned = plan(consumers, config);

        List<EndpointSpec> bound = new ArrayList<>(planned.size());
        for (PlannedEndpoint endpoint : planned) {
            EndpointSpec spec = endpoint.getSpec();
            log.info("Binding endpoint → consumer={} queue={} prefetch={} exchange={}",
                    endpoint.getIdentity().getTypeName(),
                    spec.getQueueName(),
                    spec.getPrefetchCount(),
                    spec.getExchangeKind());

            binder.bind(spec, endpoint.getConsumer());
            bound.add(spec);
        }

        log.info("Registered {} endpoint(s) with prefix '{}'", bound.size(), config.getPrefix());
        return List.copyOf(bound);
    }

    /**
     * Derive and validate the specs without binding anything.
     */
    public List<PlannedEndpoint> plan(List<? extends WireConsumer<?>> consumers, RabbitWireProperties config) {
        Map<String, String> ownerByQueue = new HashMap<>();
        Map<Class<?>, Set<String>> seen = new HashMap<>();
        List<PlannedEndpoint> planned = new ArrayList<>(consumers.size());

        for (WireConsumer<?> consumer : consumers) {
            ConsumerIdentity identity = ConsumerIdentity.of(consumer.identity());
            Class<?> consumerType = ClassUtils.getUserClass(consumer);

            // same class under the same identity; anything else goes through the collision check
            if (!seen.computeIfAbsent(consumerType, type -> new HashSet<>()).add(identity.getTypeName())) {
                log.warn("Consumer '{}' ({}) listed more than once → binding it once",
                        identity.getTypeName(), consumerType.getName());
                continue;
            }

            EndpointSpec spec = buildSpec(consumer, identity, config);

            String description = identity.getTypeName() + " [" + consumerType.getName() + "]";
            String owner = ownerByQueue.putIfAbsent(spec.getQueueName(), description);
            if (owner != null) {
                throw new RegistrationException(
                        "Queue '" + spec.getQueueName() + "' is derived by both '" + owner
                                + "' and '" + description + "'");
            }

            planned.add(new PlannedEndpoint(consumer, identity, spec));
        }

        return planned;
    }

    private EndpointSpec buildSpec(WireConsumer<?> consumer, ConsumerIdentity identity, RabbitWireProperties config) {
        RabbitWireProperties.EndpointDefaults defaults = config.getEndpoint();

        RetryDescriptor retry = retryPolicyBuilder.build(
                defaults.getRetryLimit(),
                defaults.getRetryInterval(),
                consumer.retryExemptions());

        EndpointSpec.EndpointSpecBuilder builder = EndpointSpec.builder()
                .queueName(resolver.resolve(identity, config.getPrefix()))
                .routingKey(identity.getEventName())
                .exchangeKind(defaults.getExchangeKind())
                .prefetchCount(defaults.getPrefetchCount())
                .configureConsumeTopology(defaults.isConfigureConsumeTopology())
                .autoDelete(defaults.isAutoDelete())
                .retry(retry);

        consumer.customize(builder);
        return builder.build();
    }

    /**
     * A consumer paired with the spec derived for it.
     */
    @Value
    public static class PlannedEndpoint {
        WireConsumer<?> consumer;
        ConsumerIdentity identity;
        EndpointSpec spec;
    }
}
