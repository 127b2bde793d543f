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
import com.google.protobuf.ByteString;
import com.google.protobuf.Timestamp;
import com.google.pubsub.v1.PubsubMessage;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class GoogleCloudRawMessageTest {

    private final AckReplyConsumer reply = mock(AckReplyConsumer.class);

    @Test
    void exposesPubsubMessageFields() {
        PubsubMessage message = PubsubMessage.newBuilder()
                .setMessageId("123")
                .setData(ByteString.copyFromUtf8("hello"))
                .putAttributes("tenant", "acme")
                .setOrderingKey("customer-7")
                .setPublishTime(Timestamp.newBuilder().setSeconds(1_700_000_000L).setNanos(500))
                .build();

        GoogleCloudRawMessage raw = new GoogleCloudRawMessage(message, reply);

        assertThat(raw.getMessageId()).isEqualTo("123");
        assertThat(new String(raw.getData(), StandardCharsets.UTF_8)).isEqualTo("hello");
        assertThat(raw.getAttributes()).containsEntry("tenant", "acme");
        assertThat(raw.getOrderingKey()).isEqualTo("customer-7");
        assertThat(raw.getPublishTime()).isEqualTo(Instant.ofEpochSecond(1_700_000_000L, 500));
    }

    @Test
    void publishTimeIsNullWhenUnset() {
        GoogleCloudRawMessage raw = new GoogleCloudRawMessage(PubsubMessage.newBuilder().setMessageId("1").build(), reply);

        assertThat(raw.getPublishTime()).isNull();
        assertThat(raw.getOrderingKey()).isEmpty();
    }

    @Test
    void ackAndNackGoToReplyConsumer() {
        new GoogleCloudRawMessage(PubsubMessage.getDefaultInstance(), reply).ack();
        verify(reply).ack();
        verify(reply, never()).nack();

        AckReplyConsumer other = mock(AckReplyConsumer.class);
        new GoogleCloudRawMessage(PubsubMessage.getDefaultInstance(), other).nack();
        verify(other).nack();
    }
}
