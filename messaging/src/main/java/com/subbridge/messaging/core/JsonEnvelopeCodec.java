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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.subbridge.common.exception.DecodeFailedException;
import com.subbridge.common.util.JsonUtil;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Codec for producers that wrap every message in a JSON envelope:
 *
 * <pre>{@code
 *   {"uuid": "0b9c...", "metadata": {"tenant": "acme"}, "payload": {"orderId": 42}}
 * }</pre>
 *
 * A textual payload becomes its UTF-8 bytes; any other JSON payload is kept as serialized JSON.
 * Broker attributes are merged into the metadata, envelope entries taking precedence.
 */
public class JsonEnvelopeCodec implements MessageCodec {

    static final String UUID_FIELD = "uuid";
    static final String METADATA_FIELD = "metadata";
    static final String PAYLOAD_FIELD = "payload";

    @Override
    public Message decode(RawMessage raw) {
        JsonNode envelope;
        try {
            envelope = JsonUtil.readTree(raw.getData());
        } catch (IOException e) {
            throw new DecodeFailedException("message " + raw.getMessageId() + " is not a JSON envelope", e);
        }
        if (!envelope.isObject()) {
            throw new DecodeFailedException("message " + raw.getMessageId() + " envelope must be a JSON object");
        }

        JsonNode uuid = envelope.get(UUID_FIELD);
        if (uuid == null || !uuid.isTextual() || uuid.asText().isEmpty()) {
            throw new DecodeFailedException("message " + raw.getMessageId() + " envelope has no uuid");
        }

        Map<String, String> metadata = new LinkedHashMap<>(raw.getAttributes());
        JsonNode meta = envelope.get(METADATA_FIELD);
        if (meta != null && !meta.isNull()) {
            if (!meta.isObject()) {
                throw new DecodeFailedException("message " + raw.getMessageId() + " metadata must be a JSON object");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = meta.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                metadata.put(field.getKey(), field.getValue().asText());
            }
        }

        return new Message(uuid.asText(), payloadBytes(envelope.get(PAYLOAD_FIELD)), metadata);
    }

    @Override
    public EncodedMessage encode(Message message) {
        ObjectNode envelope = JsonUtil.newObject();
        envelope.put(UUID_FIELD, message.getUuid());
        ObjectNode meta = envelope.putObject(METADATA_FIELD);
        message.getMetadata().forEach(meta::put);
        envelope.put(PAYLOAD_FIELD, message.getPayloadAsString());
        return new EncodedMessage(JsonUtil.toBytes(envelope), Map.of());
    }

    private static byte[] payloadBytes(JsonNode payload) {
        if (payload == null || payload.isNull()) return new byte[0];
        if (payload.isTextual()) return payload.asText().getBytes(StandardCharsets.UTF_8);
        return JsonUtil.toBytes(payload);
    }
}
