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

/**
 * Derives the broker subscription name from a topic name.
 */
@FunctionalInterface
public interface SubscriptionNameFunction {

    String apply(String topic);

    /** Subscription named exactly like the topic. */
    static SubscriptionNameFunction identity() {
        return topic -> topic;
    }

    static SubscriptionNameFunction withSuffix(String suffix) {
        return topic -> topic + suffix;
    }

    static SubscriptionNameFunction withPrefix(String prefix) {
        return topic -> prefix + topic;
    }

    /** Apply this function, then {@code next} to its result. */
    default SubscriptionNameFunction andThen(SubscriptionNameFunction next) {
        return topic -> next.apply(apply(topic));
    }
}
