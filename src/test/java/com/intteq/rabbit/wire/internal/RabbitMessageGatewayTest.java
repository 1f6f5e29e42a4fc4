package com.intteq.rabbit.wire.internal;

import com.intteq.rabbit.wire.endpoint.EndpointConventions;
import com.intteq.rabbit.wire.exception.ConventionNotFoundException;
import com.intteq.rabbit.wire.exception.DeliveryException;
import com.intteq.rabbit.wire.support.OrderShipped;
import com.intteq.rabbit.wire.support.ProductCreated;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.ReturnedMessage;
import org.springframework.amqp.rabbit.connection.CorrelationData;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

import java.net.ConnectException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.doAnswer;
import static org.mockito.BDDMockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("RabbitMessageGateway")
class RabbitMessageGatewayTest {

    private static final String PRODUCT_QUEUE = "dev.productcreated.event.v1";

    @Mock
    private RabbitTemplate rabbitTemplate;

    private SimpleMeterRegistry meterRegistry;
    private RabbitMessageGateway gateway;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        EndpointConventions conventions = EndpointConventions.builder()
                .map(ProductCreated.class, PRODUCT_QUEUE)
                .build();
        gateway = new RabbitMessageGateway(rabbitTemplate, conventions, meterRegistry);
    }

    @Test
    @DisplayName("instance id is fixed for the gateway's lifetime and unique per gateway")
    void instanceId_StableAndUnique() {
        RabbitMessageGateway other =
                new RabbitMessageGateway(rabbitTemplate, EndpointConventions.empty(), meterRegistry);

        assertThat(gateway.instanceId()).isEqualTo(gateway.instanceId());
        assertThat(gateway.instanceId()).isNotEqualTo(other.instanceId());
    }

    @Nested
    @DisplayName("sendTo - Publisher Confirms")
    class SendTo {

        @Test
        @DisplayName("bare address: default exchange, queue name as routing key, completes on ACK")
        void sendTo_BareAddress_BrokerAck_Completes() {
            // given
            givenBrokerConfirm(true, null);
            ProductCreated message = new ProductCreated("sku-1");

            // when
            CompletableFuture<Void> result = gateway.sendTo(message, PRODUCT_QUEUE);

            // then
            assertThat(result).isCompleted().isNotCompletedExceptionally();
            verify(rabbitTemplate).convertAndSend(eq(""), eq(PRODUCT_QUEUE), eq(message), any(CorrelationData.class));
            assertThat(meterRegistry.counter("rabbit-wire.send.success", "address", PRODUCT_QUEUE).count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("queue: scheme → default exchange")
        void sendTo_QueueScheme_DefaultExchange() {
            // given
            givenBrokerConfirm(true, null);

            // when
            gateway.sendTo(new ProductCreated("sku-1"), "queue:audit.v1");

            // then
            verify(rabbitTemplate).convertAndSend(eq(""), eq("audit.v1"), any(Object.class), any(CorrelationData.class));
        }

        @Test
        @DisplayName("exchange: scheme → named exchange, empty routing key")
        void sendTo_ExchangeScheme_NamedExchange() {
            // given
            givenBrokerConfirm(true, null);

            // when
            gateway.sendTo(new ProductCreated("sku-1"), "exchange:ProductCreated.event");

            // then
            verify(rabbitTemplate).convertAndSend(
                    eq("ProductCreated.event"), eq(""), any(Object.class), any(CorrelationData.class));
        }

        @Test
        @DisplayName("NACK → DeliveryException carrying the address")
        void sendTo_BrokerNack_DeliveryException() {
            // given
            givenBrokerConfirm(false, "queue full");

            // when
            CompletableFuture<Void> result = gateway.sendTo(new ProductCreated("sku-1"), PRODUCT_QUEUE);

            // then
            assertThatThrownBy(result::join)
                    .isInstanceOf(CompletionException.class)
                    .cause()
                    .isInstanceOf(DeliveryException.class)
                    .hasMessageContaining("queue full");
            assertThat(meterRegistry.counter("rabbit-wire.send.failure", "address", PRODUCT_QUEUE).count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("returned as unroutable → DeliveryException")
        void sendTo_Returned_DeliveryException() {
            // given
            doAnswer(invocation -> {
                CorrelationData cd = invocation.getArgument(3);
                cd.setReturned(new ReturnedMessage(new Message(new byte[0]), 312, "NO_ROUTE", "", "missing.v1"));
                cd.getFuture().complete(new CorrelationData.Confirm(true, null));
                return null;
            }).when(rabbitTemplate).convertAndSend(anyString(), anyString(), any(Object.class), any(CorrelationData.class));

            // when
            CompletableFuture<Void> result = gateway.sendTo(new ProductCreated("sku-1"), "missing.v1");

            // then
            assertThatThrownBy(result::join)
                    .cause()
                    .isInstanceOf(DeliveryException.class)
                    .hasMessageContaining("unroutable");
        }

        @Test
        @DisplayName("publish throws AmqpException → DeliveryException with the original cause")
        void sendTo_PublishFails_DeliveryException() {
            // given
            AmqpConnectException connectionLost = new AmqpConnectException(new ConnectException("refused"));
            doThrow(connectionLost).when(rabbitTemplate)
                    .convertAndSend(anyString(), anyString(), any(Object.class), any(CorrelationData.class));

            // when
            CompletableFuture<Void> result = gateway.sendTo(new ProductCreated("sku-1"), PRODUCT_QUEUE);

            // then
            assertThatThrownBy(result::join)
                    .cause()
                    .isInstanceOf(DeliveryException.class)
                    .hasCause(connectionLost);
        }

        @Test
        @DisplayName("confirm future fails → DeliveryException")
        void sendTo_ConfirmFails_DeliveryException() {
            // given
            doAnswer(invocation -> {
                CorrelationData cd = invocation.getArgument(3);
                cd.getFuture().completeExceptionally(new RuntimeException("connection lost"));
                return null;
            }).when(rabbitTemplate).convertAndSend(anyString(), anyString(), any(Object.class), any(CorrelationData.class));

            // when
            CompletableFuture<Void> result = gateway.sendTo(new ProductCreated("sku-1"), PRODUCT_QUEUE);

            // then
            assertThatThrownBy(result::join)
                    .cause()
                    .isInstanceOf(DeliveryException.class)
                    .satisfies(e -> assertThat(((DeliveryException) e).getAddress()).isEqualTo(PRODUCT_QUEUE));
        }

        @Test
        @DisplayName("blank address → IllegalArgumentException, nothing published")
        void sendTo_BlankAddress_Rejected() {
            assertThatThrownBy(() -> gateway.sendTo(new ProductCreated("sku-1"), " "))
                    .isInstanceOf(IllegalArgumentException.class);

            verifyNoInteractions(rabbitTemplate);
        }
    }

    @Nested
    @DisplayName("send by convention")
    class Send {

        @Test
        @DisplayName("known type → published to its queue")
        void send_KnownType_PublishedToConventionQueue() {
            // given
            givenBrokerConfirm(true, null);

            // when
            CompletableFuture<Void> result = gateway.send(new ProductCreated("sku-1"));

            // then
            assertThat(result).isCompleted().isNotCompletedExceptionally();
            verify(rabbitTemplate).convertAndSend(eq(""), eq(PRODUCT_QUEUE), any(Object.class), any(CorrelationData.class));
        }

        @Test
        @DisplayName("unknown type → ConventionNotFoundException, no transport interaction")
        void send_UnknownType_ConventionNotFound() {
            // when
            CompletableFuture<Void> result = gateway.send(new OrderShipped(7L));

            // then
            assertThatThrownBy(result::join)
                    .cause()
                    .isInstanceOf(ConventionNotFoundException.class)
                    .hasMessageContaining(OrderShipped.class.getName());
            verifyNoInteractions(rabbitTemplate);
        }
    }

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        @Test
        @DisplayName("signal already completed → nothing is published")
        void send_AlreadyCancelled_NoPublish() {
            // when
            CompletableFuture<Void> result =
                    gateway.sendTo(new ProductCreated("sku-1"), PRODUCT_QUEUE, CompletableFuture.completedFuture(null));

            // then
            assertThat(result).isCancelled();
            verifyNoInteractions(rabbitTemplate);
        }

        @Test
        @DisplayName("signal while awaiting the confirm → CancellationException, not DeliveryException")
        void send_CancelledWhilePending_CancellationException() {
            // given: the broker never confirms
            CompletableFuture<Void> signal = new CompletableFuture<>();
            CompletableFuture<Void> result = gateway.send(new ProductCreated("sku-1"), signal);

            // when
            signal.complete(null);

            // then
            assertThat(result).isCancelled();
            assertThatThrownBy(result::join).isInstanceOf(CancellationException.class);
        }

        @Test
        @DisplayName("signal completed exceptionally also cancels the pending send")
        void send_SignalFailed_Cancelled() {
            // given
            CompletableFuture<Void> signal = new CompletableFuture<>();
            CompletableFuture<Void> result = gateway.send(new ProductCreated("sku-1"), signal);

            // when
            signal.completeExceptionally(new IllegalStateException("shutting down"));

            // then
            assertThat(result).isCancelled();
        }

        @Test
        @DisplayName("a signal shared by many sends keeps no callbacks once they complete")
        void send_SharedSignal_NoCallbacksRetained() {
            // given
            givenBrokerConfirm(true, null);
            CompletableFuture<Void> shutdown = new CompletableFuture<>();

            // when
            for (int i = 0; i < 1_000; i++) {
                assertThat(gateway.send(new ProductCreated("sku-" + i), shutdown)).isCompleted();
            }

            // then
            assertThat(shutdown.getNumberOfDependents()).isZero();
        }

        @Test
        @DisplayName("a late confirm does not override a cancelled future")
        void send_CancelledThenNack_StaysCancelled() {
            // given
            CorrelationData[] captured = new CorrelationData[1];
            doAnswer(invocation -> {
                captured[0] = invocation.getArgument(3);
                return null;
            }).when(rabbitTemplate).convertAndSend(anyString(), anyString(), any(Object.class), any(CorrelationData.class));
            CompletableFuture<Void> result = gateway.sendTo(new ProductCreated("sku-1"), PRODUCT_QUEUE);

            // when
            result.cancel(false);
            captured[0].getFuture().complete(new CorrelationData.Confirm(false, "late"));

            // then
            assertThat(result).isCancelled();
        }
    }

    private void givenBrokerConfirm(boolean ack, String reason) {
        doAnswer(invocation -> {
            CorrelationData cd = invocation.getArgument(3);
            cd.getFuture().complete(new CorrelationData.Confirm(ack, reason));
            return null;
        }).when(rabbitTemplate).convertAndSend(anyString(), anyString(), any(Object.class), any(CorrelationData.class));
    }
}
