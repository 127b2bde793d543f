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

import java.time.Instant;
import java.util.Map;

/**
 * Broker-native message as yielded by a receive session, together with its ack/nack controls.
 * The controls talk to the broker directly; callers must invoke at most one of them.
 */
public interface RawMessage {

    /** Broker-assigned message id. */
    String getMessageId();

    byte[] getData();

    Map<String, String> getAttributes();

    /** Publish time, or null if the broker does not report one. */
    Instant getPublishTime();

    /** Ordering key, empty when ordering is not used. */
    default String getOrderingKey() { return ""; }

    void ack();

    void nack();
}
