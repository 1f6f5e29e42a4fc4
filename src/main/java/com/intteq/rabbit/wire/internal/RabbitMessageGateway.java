package com.intteq.rabbit.wire.internal;

import com.intteq.rabbit.wire.MessageGateway;
import com.intteq.rabbit.wire.endpoint.EndpointConventions;
import com.intteq.rabbit.wire.endpoint.SendAddress;
import com.intteq.rabbit.wire.exception.ConventionNotFoundException;
import com.intteq.rabbit.wire.exception.DeliveryException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.ReturnedMessage;
import org.springframework.amqp.rabbit.connection.CorrelationData;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.lang.Nullable;
import org.springframework.util.Assert;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * {@link MessageGateway} publishing through a {@link RabbitTemplate} with correlated
 * publisher confirms. Holds no mutable state.
 */
@Slf4j
public class RabbitMessageGateway implements MessageGateway {

    private final UUID instanceId = UUID.randomUUID();

    private final RabbitTemplate rabbitTemplate;
    private final EndpointConventions conventions;
    private final MeterRegistry meterRegistry;

    public RabbitMessageGateway(RabbitTemplate rabbitTemplate,
                                EndpointConventions conventions,
                                MeterRegistry meterRegistry) {
        this.rabbitTemplate = rabbitTemplate;
        this.conventions = conventions;
        this.meterRegistry = meterRegistry;
        log.info("Message gateway created: instanceId={}", instanceId);
    }

    @Override
    public UUID instanceId() {
        return instanceId;
    }

    @Override
    public CompletableFuture<Void> sendTo(Object message, String address, @Nullable CompletionStage<?> cancellation) {
        Assert.notNull(message, "message must not be null");
        SendAddress target = SendAddress.parse(address);
        return publish(message, address, target, cancellation);
    }

    @Override
    public CompletableFuture<Void> send(Object message, @Nullable CompletionStage<?> cancellation) {
        Assert.notNull(message, "message must not be null");

        Optional<String> address = conventions.find(message.getClass());
        if (address.isEmpty()) {
            log.error("No send convention for message type {} (gateway={})", message.getClass().getName(), instanceId);
            return CompletableFuture.failedFuture(new ConventionNotFoundException(message.getClass()));
        }
        return sendTo(message, address.get(), cancellation);
    }

    private CompletableFuture<Void> publish(Object message,
                                            String address,
                                            SendAddress target,
                                            @Nullable CompletionStage<?> cancellation) {

        CompletableFuture<Void> result = new CompletableFuture<>();
        if (cancellation != null) {
            // detached from the signal once the send completes
            result.runAfterEither(cancellation, () -> { })
                    .whenComplete((ignored, error) -> result.cancel(false));
        }
        if (result.isCancelled()) {
            log.debug("Send cancelled before publishing (address={} gateway={})", address, instanceId);
            return result;
        }

        meterRegistry.counter("rabbit-wire.send.attempt", "address", address).increment();

        CorrelationData correlation = new CorrelationData(UUID.randomUUID().toString());
        try {
            rabbitTemplate.convertAndSend(target.getExchange(), target.getRoutingKey(), message, correlation);
        } catch (AmqpException ex) {
            recordFailure(address);
            log.error("Failed to send message to {} (gateway={})", address, instanceId, ex);
            result.completeExceptionally(new DeliveryException(address, "Failed to send message to " + address, ex));
            return result;
        }

        correlation.getFuture().whenComplete((confirm, error) -> {
            if (error != null) {
                fail(result, address, new DeliveryException(address, "No confirm received for " + address, error));
                return;
            }
            ReturnedMessage returned = correlation.getReturned();
            if (returned != null) {
                fail(result, address, new DeliveryException(address,
                        "Message returned as unroutable by " + address + ": " + returned.getReplyText()));
                return;
            }
            if (!confirm.isAck()) {
                fail(result, address, new DeliveryException(address,
                        "Broker rejected message for " + address + ": " + confirm.getReason()));
                return;
            }

            meterRegistry.counter("rabbit-wire.send.success", "address", address).increment();
            log.debug("Message confirmed: address={} correlationId={}", address, correlation.getId());
            result.complete(null);
        });

        return result;
    }

    private void fail(CompletableFuture<Void> result, String address, DeliveryException error) {
        recordFailure(address);
        log.error("Delivery failed: {} (gateway={})", error.getMessage(), instanceId);
        result.completeExceptionally(error);
    }

    private void recordFailure(String address) {
        meterRegistry.counter("rabbit-wire.send.failure", "address", address).increment();
    }
}
