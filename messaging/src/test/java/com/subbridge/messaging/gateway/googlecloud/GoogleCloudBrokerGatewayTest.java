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

import com.google.api.gax.grpc.GrpcStatusCode;
import com.google.api.gax.rpc.NotFoundException;
import com.google.cloud.pubsub.v1.AckReplyConsumer;
import com.google.cloud.pubsub.v1.Subscriber;
import com.google.cloud.pubsub.v1.SubscriptionAdminClient;
import com.google.cloud.pubsub.v1.TopicAdminClient;
import com.google.protobuf.ByteString;
import com.google.pubsub.v1.PubsubMessage;
import com.google.pubsub.v1.Subscription;
import com.google.pubsub.v1.SubscriptionName;
import com.google.pubsub.v1.Topic;
import com.google.pubsub.v1.TopicName;
import com.subbridge.common.exception.ReceiveFailedException;
import com.subbridge.common.exception.SubBridgeException;
import com.subbridge.messaging.core.CancellationToken;
import com.subbridge.messaging.core.RawMessage;
import com.subbridge.messaging.gateway.RawMessageHandler;
import com.subbridge.messaging.gateway.SubscriptionHandle;
import com.subbridge.messaging.gateway.SubscriptionOptions;
import com.subbridge.messaging.gateway.TopicRef;
import io.grpc.Status;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GoogleCloudBrokerGatewayTest {

    private static final String PROJECT = "acme";

    private TopicAdminClient topicAdmin;
    private SubscriptionAdminClient subscriptionAdmin;
    private GoogleCloudBrokerGateway gateway;

    @BeforeEach
    void setUp() {
        topicAdmin = mock(TopicAdminClient.class);
        subscriptionAdmin = mock(SubscriptionAdminClient.class);
        gateway = new GoogleCloudBrokerGateway(PROJECT, ConnectionOptions.defaults(),
                topicAdmin, subscriptionAdmin, null, null, null);
    }

    @Test
    void notFoundMeansAbsent() {
        when(topicAdmin.getTopic(TopicName.of(PROJECT, "orders"))).thenThrow(notFound());
        when(subscriptionAdmin.getSubscription(SubscriptionName.of(PROJECT, "orders"))).thenThrow(notFound());

        assertThat(gateway.topicExists("orders")).isFalse();
        assertThat(gateway.subscriptionExists("orders")).isFalse();
    }

    @Test
    void foundMeansPresent() {
        when(topicAdmin.getTopic(TopicName.of(PROJECT, "orders"))).thenReturn(Topic.getDefaultInstance());
        when(subscriptionAdmin.getSubscription(SubscriptionName.of(PROJECT, "orders")))
                .thenReturn(Subscription.getDefaultInstance());

        assertThat(gateway.topicExists("orders")).isTrue();
        assertThat(gateway.subscriptionExists("orders")).isTrue();
    }

    @Test
    void otherRpcFailuresPropagate() {
        IllegalStateException unavailable = new IllegalStateException("unavailable");
        when(topicAdmin.getTopic(TopicName.of(PROJECT, "orders"))).thenThrow(unavailable);

        assertThatThrownBy(() -> gateway.topicExists("orders")).isSameAs(unavailable);
    }

    @Test
    void createTopicUsesProjectScopedName() {
        TopicRef topic = gateway.createTopic("orders");

        assertThat(topic.name()).isEqualTo("orders");
        verify(topicAdmin).createTopic(TopicName.of(PROJECT, "orders"));
    }

    @Test
    void createSubscriptionAppliesOptions() {
        SubscriptionOptions options = SubscriptionOptions.builder()
                .ackDeadline(Duration.ofSeconds(30))
                .messageRetention(Duration.ofDays(1))
                .retainAckedMessages(true)
                .enableMessageOrdering(true)
                .filter("attributes.region = \"eu\"")
                .label("team", "payments")
                .build();

        SubscriptionHandle handle = gateway.createSubscription("orders_billing", new TopicRef("orders"), options);

        ArgumentCaptor<Subscription> request = ArgumentCaptor.forClass(Subscription.class);
        verify(subscriptionAdmin).createSubscription(request.capture());
        Subscription sent = request.getValue();
        assertThat(sent.getName()).isEqualTo("projects/acme/subscriptions/orders_billing");
        assertThat(sent.getTopic()).isEqualTo("projects/acme/topics/orders");
        assertThat(sent.getAckDeadlineSeconds()).isEqualTo(30);
        assertThat(sent.getMessageRetentionDuration().getSeconds()).isEqualTo(86_400L);
        assertThat(sent.getRetainAckedMessages()).isTrue();
        assertThat(sent.getEnableMessageOrdering()).isTrue();
        assertThat(sent.getFilter()).isEqualTo("attributes.region = \"eu\"");
        assertThat(sent.getLabelsMap()).containsEntry("team", "payments");
        assertThat(handle.name()).isEqualTo("orders_billing");
        assertThat(handle.topic()).isEqualTo("orders");
    }

    @Test
    void defaultOptionsLeaveBrokerDefaults() {
        Subscription sent = gateway.toSubscriptionRequest("orders", new TopicRef("orders"), SubscriptionOptions.defaults());

        assertThat(sent.getAckDeadlineSeconds()).isZero();
        assertThat(sent.hasMessageRetentionDuration()).isFalse();
        assertThat(sent.getFilter()).isEmpty();
    }

    @Test
    void closeReleasesBothAdminClients() {
        gateway.close();

        verify(topicAdmin).close();
        verify(subscriptionAdmin).close();
    }

    @Test
    void closeFailureIsReportedAfterReleasingEverything() {
        doThrow(new IllegalStateException("already shut down")).when(topicAdmin).close();

        assertThatThrownBy(() -> gateway.close())
                .isInstanceOf(SubBridgeException.class)
                .extracting(e -> ((SubBridgeException) e).getErrorCode())
                .isEqualTo("SUB_CLOSE_FAILED");
        verify(subscriptionAdmin).close();
    }

    @Test
    void receiveStopsStreamingPullOnCancel() throws Exception {
        Subscriber subscriber = mock(Subscriber.class);
        CountDownLatch terminated = new CountDownLatch(1);
        when(subscriber.startAsync()).thenReturn(subscriber);
        doAnswer(inv -> { terminated.await(5, TimeUnit.SECONDS); return null; }).when(subscriber).awaitTerminated();
        doAnswer(inv -> { terminated.countDown(); return subscriber; }).when(subscriber).stopAsync();
        CancellationToken token = CancellationToken.create();

        CompletableFuture<Void> session = CompletableFuture.runAsync(() ->
                streamingWith(subscriber).receive(new SubscriptionHandle("orders", "orders"), token, m -> { }));
        await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> verify(subscriber).awaitTerminated());
        assertThat(session).isNotDone();

        token.cancel();

        session.get(2, TimeUnit.SECONDS);
        verify(subscriber).awaitRunning();
        verify(subscriber).stopAsync();
    }

    @Test
    void receiveReturnsNormallyWhenStartFailsAfterCancel() {
        Subscriber subscriber = mock(Subscriber.class);
        when(subscriber.startAsync()).thenThrow(new IllegalStateException("Service already stopped"));
        CancellationToken token = CancellationToken.create();
        token.cancel();

        streamingWith(subscriber).receive(new SubscriptionHandle("orders", "orders"), token, m -> { });

        verify(subscriber).stopAsync();
    }

    @Test
    void failedStreamingPullBecomesReceiveFailure() {
        Subscriber subscriber = mock(Subscriber.class);
        RuntimeException streamReset = new RuntimeException("stream reset");
        when(subscriber.startAsync()).thenReturn(subscriber);
        doThrow(new IllegalStateException("failed", streamReset)).when(subscriber).awaitTerminated();

        assertThatThrownBy(() -> streamingWith(subscriber)
                .receive(new SubscriptionHandle("orders", "orders"), CancellationToken.create(), m -> { }))
                .isInstanceOf(ReceiveFailedException.class)
                .hasCause(streamReset);
    }

    @Test
    void receiverWrapsPulledMessageForHandler() {
        List<RawMessage> seen = new ArrayList<>();
        RawMessageHandler handler = seen::add;
        AckReplyConsumer reply = mock(AckReplyConsumer.class);
        PubsubMessage pulled = PubsubMessage.newBuilder()
                .setMessageId("m-1")
                .setData(ByteString.copyFromUtf8("hello"))
                .build();

        GoogleCloudBrokerGateway.receiverFor(handler).receiveMessage(pulled, reply);

        assertThat(seen).hasSize(1);
        assertThat(seen.get(0).getMessageId()).isEqualTo("m-1");
        seen.get(0).ack();
        verify(reply).ack();
    }

    @Test
    void callbacksRunOnSingleThreadByDefault() {
        assertThat(ConnectionOptions.defaults().getExecutorThreadCount()).isEqualTo(1);
        assertThatThrownBy(() -> ConnectionOptions.builder().executorThreadCount(0).build())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void connectRequiresProjectId() {
        assertThatThrownBy(() -> GoogleCloudBrokerGateway.connect(" ", ConnectionOptions.defaults()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void providerNameIsStable() {
        assertThat(gateway.providerName()).isEqualTo("googlecloudpubsub");
        when(subscriptionAdmin.getSubscription(any(SubscriptionName.class))).thenThrow(notFound());
        assertThat(gateway.subscriptionExists("x")).isFalse();
    }

    private GoogleCloudBrokerGateway streamingWith(Subscriber subscriber) {
        return new GoogleCloudBrokerGateway(PROJECT, ConnectionOptions.defaults(),
                topicAdmin, subscriptionAdmin, null, null, null) {
            @Override
            Subscriber newSubscriber(SubscriptionHandle subscription, RawMessageHandler handler) {
                return subscriber;
            }
        };
    }

    private static NotFoundException notFound() {
        return new NotFoundException(new RuntimeException("not found"), GrpcStatusCode.of(Status.Code.NOT_FOUND), false);
    }
}
