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

import java.util.Map;

/**
 * Broker-ready representation produced by {@link MessageCodec#encode(Message)}.
 *
 * @param data       message body
 * @param attributes string attributes sent alongside the body
 */
public record EncodedMessage(byte[] data, Map<String, String> attributes) {
    public EncodedMessage {
        data = data != null ? data : new byte[0];
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }
}
