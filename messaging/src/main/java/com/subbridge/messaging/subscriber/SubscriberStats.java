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
 * Point-in-time counters of a {@link PubSubSubscriber}.
 */
public record SubscriberStats(
        long received,
        long delivered,
        long acked,
        long nacked,
        long decodeFailures,
        int activeLoops,
        int subscriptions
) {}
