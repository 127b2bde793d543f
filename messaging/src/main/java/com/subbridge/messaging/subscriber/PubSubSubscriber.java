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

import com.subbridge.common.exception.SubBridgeException;
import com.subbridge.common.exception.SubscriberClosedException;
import com.subbridge.messaging.core.CancellationToken;
import com.subbridge.messaging.core.DeliveryChannel;
import com.subbridge.messaging.core.MessageSubscriber;
import com.subbridge.messaging.gateway.BrokerGateway;
import com.subbridge.messaging.gateway.SubscriptionHandle;
import com.subbridge.messaging.gateway.googlecloud.GoogleCloudBrokerGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link MessageSubscriber} backed by a managed publish/subscribe broker.
 *
 * <p>Each {@link #subscribe(String)} resolves (and on first use provisions) the subscription
 * derived from the topic, starts a {@link DeliveryLoop} on a daemon thread and returns the
 * subscription's {@link DeliveryChannel} at once. Consumers take messages from the channel and
 * must ack or nack every one of them.
 *
 * <p>Usage:
 * <pre>{@code
 *   try (PubSubSubscriber subscriber = new PubSubSubscriber(config)) {
 *       DeliveryChannel orders = subscriber.subscribe("orders");
 *       Message msg;
 *       while ((msg = orders.receive()) != null) {
 *           process(msg);
 *           msg.ack();
 *       }
 *   }
 * }</pre>
 *
 * <p>{@link #close()} stops every loop, nacks anything still in flight, waits for all loops to
 * exit and then releases the broker connection. It is idempotent.
 */
public class PubSubSubscriber implements MessageSubscriber {

    private static final Logger log = LoggerFactory.getLogger(PubSubSubscriber.class);
    private static final AtomicInteger THREAD_SEQ = new AtomicInteger();

    private final SubscriberConfig config;
    private final BrokerGateway gateway;
    private final SubscriptionRegistry registry;
    private final ShutdownCoordinator coordinator = new ShutdownCoordinator();
    private final DeliveryCounters counters = new DeliveryCounters();
    private final ExecutorService deliveryExecutor;

    /** Connect to Google Cloud Pub/Sub using the project and connection options in {@code config}. */
    public PubSubSubscriber(SubscriberConfig config) {
        this(config, GoogleCloudBrokerGateway.connect(config.getProjectId(), config.getConnectionOptions()));
    }

    public PubSubSubscriber(SubscriberConfig config, BrokerGateway gateway) {
        if (config == null) throw new IllegalArgumentException("config must not be null");
        if (gateway == null) throw new IllegalArgumentException("gateway must not be null");
        this.config = config;
        this.gateway = gateway;
        this.registry = new SubscriptionRegistry(config.getSubscriptionNameFunction(),
                new SubscriptionProvisioner(gateway, config));
        this.deliveryExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "subbridge-delivery-" + THREAD_SEQ.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("PubSubSubscriber '{}' created on {}: {}", config.getSubscriberName(), gateway.providerName(), config);
    }

    @Override
    public DeliveryChannel subscribe(String topic) {
        if (coordinator.isClosed()) {
            throw new SubscriberClosedException();
        }
        String subscriptionName = registry.subscriptionName(topic);
        log.info("Subscribing to {} topic '{}' with subscription '{}'", gateway.providerName(), topic, subscriptionName);

        SubscriptionHandle handle;
        try {
            handle = registry.resolve(topic);
        } catch (SubBridgeException e) {
            log.error("Could not obtain subscription '{}' for topic '{}'", subscriptionName, topic, e);
            throw e;
        }

        DeliveryChannel output = new DeliveryChannel(topic);
        CancellationToken closing = coordinator.newScope();
        closing.onCancel(() -> {
            log.debug("Closing delivery channel for topic '{}'", topic);
            output.close();
        });

        if (!coordinator.enlist()) {
            closing.cancel();
            throw new SubscriberClosedException();
        }
        DeliveryLoop loop = new DeliveryLoop(handle, gateway, config.getCodec(), output, closing, counters,
                coordinator::release);
        try {
            deliveryExecutor.execute(loop);
        } catch (RejectedExecutionException e) {
            closing.cancel();
            coordinator.release();
            throw new SubscriberClosedException();
        }
        return output;
    }

    /**
     * The broker connection is released even when the wait for delivery loops is interrupted.
     *
     * @throws SubBridgeException with code {@code SUB_INTERRUPTED} if interrupted while draining,
     *         or {@code SUB_CLOSE_FAILED} if the broker connection cannot be released
     */
    @Override
    public void close() {
        log.info("Closing PubSubSubscriber '{}'", config.getSubscriberName());
        if (!coordinator.beginClose()) {
            log.debug("PubSubSubscriber '{}' already closed", config.getSubscriberName());
            return;
        }
        SubBridgeException drainFailure = null;
        try {
            coordinator.awaitDrained();
        } catch (SubBridgeException e) {
            log.warn("PubSubSubscriber '{}' stopped waiting for delivery loops: {}",
                    config.getSubscriberName(), e.getMessage());
            drainFailure = e;
        } finally {
            deliveryExecutor.shutdown();
        }

        try {
            gateway.close();
        } catch (RuntimeException e) {
            SubBridgeException closeFailure = e instanceof SubBridgeException
                    ? (SubBridgeException) e
                    : new SubBridgeException("SUB_CLOSE_FAILED", "cannot close " + gateway.providerName() + " client", e);
            if (drainFailure == null) throw closeFailure;
            drainFailure.addSuppressed(closeFailure);
        }
        if (drainFailure != null) throw drainFailure;
        log.info("PubSubSubscriber '{}' closed", config.getSubscriberName());
    }

    @Override
    public boolean isClosed() {
        return coordinator.isClosed();
    }

    /** Names of the subscriptions resolved so far. */
    public List<String> subscriptions() {
        return registry.subscriptionNames();
    }

    public SubscriberStats stats() {
        return counters.snapshot(coordinator.activeLoops(), registry.size());
    }

    public SubscriberConfig getConfig() { return config; }
}
