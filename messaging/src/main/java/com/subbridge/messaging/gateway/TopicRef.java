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
 * Reference to a broker-side topic. Creating a reference performs no RPC.
 */
public record TopicRef(String name) {
    public TopicRef {
        Objects.requireNonNull(name, "topic name must not be null");
    }
}
