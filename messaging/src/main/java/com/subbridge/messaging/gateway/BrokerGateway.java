/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.subbridge.messaging.gateway;

import com.subbridge.common.exception.ReceiveFailedException;
import com.subbridge.messaging.core.CancellationToken;
import com.subbridge.messaging.core.RawMessage;

/**
 * Connection to a managed publish/subscribe broker.
 *
 * <p>Existence checks and creation calls are plain RPCs; any failure is thrown as the broker
 * client's own runtime exception and wrapped by the caller. A single gateway is shared read-only
 * by every delivery loop of a subscriber, so implementations must be thread-safe.
 */
public interface BrokerGateway extends AutoCloseable {

    /** Short provider name used in log output. */
    String providerName();

    boolean topicExists(String topic);

    boolean subscriptionExists(String subscription);

    /** Reference to a topic without any RPC. */
    default TopicRef topicRef(String topic) {
        return new TopicRef(topic);
    }

    /** Handle for an existing subscription without any RPC. */
    default SubscriptionHandle subscriptionRef(String subscription) {
        return SubscriptionHandle.existing(subscription);
    }

    TopicRef createTopic(String topic);

    SubscriptionHandle createSubscription(String subscription, TopicRef topic, SubscriptionOptions options);

    /**
     * Open a streaming receive session and block until it ends.
     *
     * <p>Returns normally once {@code cancellation} fires and the session has stopped.
     *
     * @throws ReceiveFailedException if the session terminates abnormally
     */
    void receive(SubscriptionHandle subscription, CancellationToken cancellation, RawMessageHandler handler);

    default void ack(RawMessage message) {
        message.ack();
    }

    default void nack(RawMessage message) {
        message.nack();
    }

    /**
     * Release the broker connection.
     *
     * @throws com.subbridge.common.exception.SubBridgeException if releasing fails
     */
    @Override
    void close();
}
