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

import com.subbridge.messaging.core.RawMessage;

/**
 * Callback invoked by a receive session for every message pulled from the broker.
 * May be called concurrently from several broker threads; it may block.
 */
@FunctionalInterface
public interface RawMessageHandler {
    void onMessage(RawMessage message);
}
