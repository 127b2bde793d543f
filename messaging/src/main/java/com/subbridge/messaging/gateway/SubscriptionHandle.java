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

import java.util.Objects;

/**
 * Reference to a provisioned subscription.
 *
 * @param name  subscription name on the broker
 * @param topic bound topic, null when the handle was obtained for a pre-existing subscription
 */
public record SubscriptionHandle(String name, String topic) {
    public SubscriptionHandle {
        Objects.requireNonNull(name, "subscription name must not be null");
    }

    public static SubscriptionHandle existing(String name) {
        return new SubscriptionHandle(name, null);
    }
}
