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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pass-through codec: the payload is the raw data, metadata maps to broker attributes.
 *
 * <p>The message uuid travels in the reserved {@value #UUID_ATTRIBUTE} attribute. Messages
 * published by other producers lack it, in which case the broker message id is used.
 */
public class DefaultMessageCodec implements MessageCodec {

    public static final String UUID_ATTRIBUTE = "_subbridge_message_uuid";

    @Override
    public Message decode(RawMessage raw) {
        Map<String, String> metadata = new LinkedHashMap<>(raw.getAttributes());
        String uuid = metadata.remove(UUID_ATTRIBUTE);
        if (uuid == null || uuid.isEmpty()) {
            uuid = raw.getMessageId();
        }
        return new Message(uuid, raw.getData(), metadata);
    }

    @Override
    public EncodedMessage encode(Message message) {
        Map<String, String> attributes = new LinkedHashMap<>(message.getMetadata());
        attributes.put(UUID_ATTRIBUTE, message.getUuid());
        return new EncodedMessage(message.getPayload(), attributes);
    }
}
