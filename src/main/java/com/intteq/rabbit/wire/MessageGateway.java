package com.intteq.rabbit.wire;

import com.intteq.rabbit.wire.exception.ConventionNotFoundException;
import com.intteq.rabbit.wire.exception.DeliveryException;
import org.springframework.lang.Nullable;

import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Sends messages to an explicit address or to the address registered for the message type.
 *
 * <p>Returned futures complete once the broker confirmed the message and fail with:
 * <ul>
 *     <li>{@link DeliveryException} when the broker could not take the message</li>
 *     <li>{@link ConventionNotFoundException} when no address is known for the message type</li>
 *     <li>{@link CancellationException} when the caller cancelled, either by cancelling the
 *         future or by completing the {@code cancellation} stage. Whether the message reached
 *         the broker is then unknown.</li>
 * </ul>
 *
 * <p>Sends are never retried here.
 */
public interface MessageGateway {

    /**
     * Identifier of this gateway, generated once per instance. Useful to correlate logs.
     */
    UUID instanceId();

    default CompletableFuture<Void> sendTo(Object message, String address) {
        return sendTo(message, address, null);
    }

    /**
     * @param address {@code queue:name}, {@code exchange:name} or a bare queue name
     */
    CompletableFuture<Void> sendTo(Object message, String address, @Nullable CompletionStage<?> cancellation);

    default CompletableFuture<Void> send(Object message) {
        return send(message, null);
    }

    CompletableFuture<Void> send(Object message, @Nullable CompletionStage<?> cancellation);
}
