/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.subbridge.messaging.subscriber;

import com.subbridge.messaging.core.CancellationToken;
import com.subbridge.messaging.core.DeliveryChannel;
import com.subbridge.messaging.core.Message;
import com.subbridge.messaging.core.MessageCodec;
import com.subbridge.messaging.core.RawMessage;
import com.subbridge.messaging.gateway.BrokerGateway;
import com.subbridge.messaging.gateway.SubscriptionHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Streams one subscription into its {@link DeliveryChannel}.
 *
 * <p>Every broker message is decoded, handed to the consumer, and then held until the consumer
 * acks or nacks it or the subscription closes, whichever happens first. The outcome is relayed
 * to the broker exactly once. Messages that arrive after closing, or that fail to decode, are
 * nacked without reaching the consumer.
 *
 * <p>When the receive session ends, for any reason, the channel is closed and {@code onExit}
 * runs.
 */
public class DeliveryLoop implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(DeliveryLoop.class);

    private final SubscriptionHandle subscription;
    private final BrokerGateway gateway;
    private final MessageCodec codec;
    private final DeliveryChannel output;
    private final CancellationToken closing;
    /** Shared by every outcome wait of this loop so completed waits are unlinked from it. */
    private final CompletableFuture<Void> closingSignal;
    private final DeliveryCounters counters;
    private final Runnable onExit;

    DeliveryLoop(SubscriptionHandle subscription, BrokerGateway gateway, MessageCodec codec,
                 DeliveryChannel output, CancellationToken closing, DeliveryCounters counters,
                 Runnable onExit) {
        this.subscription = subscription;
        this.gateway = gateway;
        this.codec = codec;
        this.output = output;
        this.closing = closing;
        this.closingSignal = closing.whenCancelled();
        this.counters = counters;
        this.onExit = onExit;
    }

    @Override
    public void run() {
        try {
            gateway.receive(subscription, closing, this::handle);
            log.debug("Receive session for subscription '{}' ended", subscription.name());
        } catch (RuntimeException e) {
            if (closing.isCancelled()) {
                log.debug("Receive for subscription '{}' failed while closing: {}", subscription.name(), e.getMessage());
            } else {
                log.error("Receive failed for subscription '{}' on topic '{}'",
                        subscription.name(), output.getTopic(), e);
            }
        } finally {
            output.close();
            onExit.run();
        }
    }

    void handle(RawMessage raw) {
        counters.received.increment();
        Settlement settlement = new Settlement(raw);

        Message message;
        try {
            message = codec.decode(raw);
        } catch (RuntimeException e) {
            counters.decodeFailures.increment();
            log.error("Could not decode message {} from subscription '{}'", raw.getMessageId(), subscription.name(), e);
            settlement.nack();
            return;
        }

        if (closing.isCancelled()) {
            log.info("Message {} not consumed, subscriber is closing", message.getUuid());
            settlement.nack();
            return;
        }

        boolean taken;
        try {
            taken = output.offer(message);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            settlement.nack();
            return;
        }
        if (!taken) {
            log.info("Message {} not consumed, subscriber is closing", message.getUuid());
            settlement.nack();
            return;
        }
        counters.delivered.increment();

        try {
            CompletableFuture.anyOf(closingSignal, message.acked(), message.nacked()).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.warn("Unexpected failure waiting for message {} outcome", message.getUuid(), e);
        }

        // locks the message state; a consumer ack that already landed wins over closing
        if (message.nack()) {
            if (closing.isCancelled()) {
                log.debug("Message {} superseded by close before ack, nacking", message.getUuid());
            }
            settlement.nack();
        } else {
            settlement.ack();
        }
    }

    CompletableFuture<Void> closingSignal() {
        return closingSignal;
    }

    /** Relays at most one ack or nack for a broker message. */
    private final class Settlement {
        private final RawMessage raw;
        private final AtomicBoolean done = new AtomicBoolean();

        Settlement(RawMessage raw) {
            this.raw = raw;
        }

        void ack() {
            if (done.compareAndSet(false, true)) {
                gateway.ack(raw);
                counters.acked.increment();
            }
        }

        void nack() {
            if (done.compareAndSet(false, true)) {
                gateway.nack(raw);
                counters.nacked.increment();
            }
        }
    }
}
