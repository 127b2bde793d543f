/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.subbridge.messaging.gateway.googlecloud;

import com.google.cloud.pubsub.v1.AckReplyConsumer;
import com.google.protobuf.Timestamp;
import com.google.pubsub.v1.PubsubMessage;
import com.subbridge.messaging.core.RawMessage;

import java.time.Instant;
import java.util.Map;

/**
 * {@link RawMessage} view of a streaming-pull message and its reply consumer.
 */
final class GoogleCloudRawMessage implements RawMessage {

    private final PubsubMessage message;
    private final AckReplyConsumer reply;

    GoogleCloudRawMessage(PubsubMessage message, AckReplyConsumer reply) {
        this.message = message;
        this.reply = reply;
    }

    @Override
    public String getMessageId() { return message.getMessageId(); }

    @Override
    public byte[] getData() { return message.getData().toByteArray(); }

    @Override
    public Map<String, String> getAttributes() { return message.getAttributesMap(); }

    @Override
    public Instant getPublishTime() {
        if (!message.hasPublishTime()) return null;
        Timestamp ts = message.getPublishTime();
        return Instant.ofEpochSecond(ts.getSeconds(), ts.getNanos());
    }

    @Override
    public String getOrderingKey() { return message.getOrderingKey(); }

    @Override
    public void ack() { reply.ack(); }

    @Override
    public void nack() { reply.nack(); }
}
