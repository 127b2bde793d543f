/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.subbridge.messaging.core;

/**
 * Broker-agnostic subscriber: subscribe to a topic and receive a stream of acknowledgeable
 * messages. Implementations exist per broker; {@code PubSubSubscriber} is the managed
 * publish/subscribe binding.
 *
 * <p>Delivery is at-least-once. Every received {@link Message} must be acked or nacked by the
 * consumer; messages still pending when the subscriber closes are nacked and redelivered later.
 */
public interface MessageSubscriber extends AutoCloseable {

    /**
     * Subscribe to a topic. Can be called any number of times, for the same or different topics,
     * until the subscriber is closed.
     *
     * @return a live channel of messages; it is closed when the subscriber shuts down
     * @throws com.subbridge.common.exception.SubscriberClosedException if already closed
     */
    DeliveryChannel subscribe(String topic);

    /**
     * Stop all deliveries and release the broker connection. Blocks until every delivery loop
     * has exited. Calling it again is a no-op.
     */
    @Override
    void close();

    boolean isClosed();
}
