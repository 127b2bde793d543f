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

import com.google.api.gax.batching.FlowControlSettings;
import com.google.api.gax.core.CredentialsProvider;
import com.google.api.gax.core.FixedCredentialsProvider;
import com.google.api.gax.core.InstantiatingExecutorProvider;
import com.google.api.gax.core.NoCredentialsProvider;
import com.google.api.gax.grpc.GrpcTransportChannel;
import com.google.api.gax.rpc.FixedTransportChannelProvider;
import com.google.api.gax.rpc.NotFoundException;
import com.google.api.gax.rpc.TransportChannelProvider;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.pubsub.v1.AckReplyConsumer;
import com.google.cloud.pubsub.v1.MessageReceiver;
import com.google.cloud.pubsub.v1.Subscriber;
import com.google.cloud.pubsub.v1.SubscriptionAdminClient;
import com.google.cloud.pubsub.v1.SubscriptionAdminSettings;
import com.google.cloud.pubsub.v1.TopicAdminClient;
import com.google.cloud.pubsub.v1.TopicAdminSettings;
import com.google.pubsub.v1.ProjectSubscriptionName;
import com.google.pubsub.v1.PubsubMessage;
import com.google.pubsub.v1.Subscription;
import com.google.pubsub.v1.SubscriptionName;
import com.google.pubsub.v1.TopicName;
import com.subbridge.common.exception.ReceiveFailedException;
import com.subbridge.common.exception.SubBridgeException;
import com.subbridge.messaging.core.CancellationToken;
import com.subbridge.messaging.gateway.BrokerGateway;
import com.subbridge.messaging.gateway.RawMessageHandler;
import com.subbridge.messaging.gateway.SubscriptionHandle;
import com.subbridge.messaging.gateway.SubscriptionOptions;
import com.subbridge.messaging.gateway.TopicRef;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link BrokerGateway} for Google Cloud Pub/Sub.
 *
 * <p>Admin RPCs go through a shared {@link TopicAdminClient} and {@link SubscriptionAdminClient};
 * every receive session builds its own streaming-pull {@link Subscriber} that is stopped when the
 * session's cancellation token fires. All three share the same credentials and channel settings.
 *
 * <p>Use {@link #connect(String, ConnectionOptions)} to create an instance.
 */
public class GoogleCloudBrokerGateway implements BrokerGateway {

    public static final String PROVIDER_NAME = "googlecloudpubsub";

    private static final Logger log = LoggerFactory.getLogger(GoogleCloudBrokerGateway.class);
    private static final String PUBSUB_SCOPE = "https://www.googleapis.com/auth/pubsub";
    private static final long CLOSE_TIMEOUT_SECONDS = 10;

    private final String projectId;
    private final ConnectionOptions options;
    private final TopicAdminClient topicAdmin;
    private final SubscriptionAdminClient subscriptionAdmin;

    /** Null when the client library defaults apply. */
    private final CredentialsProvider credentialsProvider;
    private final TransportChannelProvider channelProvider;
    private final ManagedChannel emulatorChannel;

    GoogleCloudBrokerGateway(String projectId, ConnectionOptions options,
                             TopicAdminClient topicAdmin, SubscriptionAdminClient subscriptionAdmin,
                             CredentialsProvider credentialsProvider,
                             TransportChannelProvider channelProvider,
                             ManagedChannel emulatorChannel) {
        this.projectId = projectId;
        this.options = options;
        this.topicAdmin = topicAdmin;
        this.subscriptionAdmin = subscriptionAdmin;
        this.credentialsProvider = credentialsProvider;
        this.channelProvider = channelProvider;
        this.emulatorChannel = emulatorChannel;
    }

    /**
     * Establish admin connections for the given project.
     *
     * @throws SubBridgeException with code {@code SUB_CONNECTION_FAILED} if the clients cannot be created
     */
    public static GoogleCloudBrokerGateway connect(String projectId, ConnectionOptions options) {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId must be set for Google Cloud Pub/Sub");
        }
        ConnectionOptions opts = options != null ? options : ConnectionOptions.defaults();

        CredentialsProvider credentials = null;
        TransportChannelProvider channel = null;
        ManagedChannel managed = null;
        try {
            if (opts.getEmulatorHost() != null) {
                managed = ManagedChannelBuilder.forTarget(opts.getEmulatorHost()).usePlaintext().build();
                channel = FixedTransportChannelProvider.create(GrpcTransportChannel.create(managed));
                credentials = NoCredentialsProvider.create();
            } else if (opts.getCredentialsFile() != null) {
                credentials = loadCredentials(opts.getCredentialsFile());
            }

            TopicAdminSettings.Builder topicSettings = TopicAdminSettings.newBuilder();
            SubscriptionAdminSettings.Builder subscriptionSettings = SubscriptionAdminSettings.newBuilder();
            if (credentials != null) {
                topicSettings.setCredentialsProvider(credentials);
                subscriptionSettings.setCredentialsProvider(credentials);
            }
            if (channel != null) {
                topicSettings.setTransportChannelProvider(channel);
                subscriptionSettings.setTransportChannelProvider(channel);
            }
            if (opts.getEndpoint() != null) {
                topicSettings.setEndpoint(opts.getEndpoint());
                subscriptionSettings.setEndpoint(opts.getEndpoint());
            }

            TopicAdminClient topicAdmin = TopicAdminClient.create(topicSettings.build());
            SubscriptionAdminClient subscriptionAdmin = SubscriptionAdminClient.create(subscriptionSettings.build());

            log.info("Connected to Google Cloud Pub/Sub project '{}' {}", projectId, opts);
            return new GoogleCloudBrokerGateway(projectId, opts, topicAdmin, subscriptionAdmin,
                    credentials, channel, managed);
        } catch (IOException e) {
            if (managed != null) managed.shutdownNow();
            throw new SubBridgeException("SUB_CONNECTION_FAILED",
                    "could not connect to Google Cloud Pub/Sub project '" + projectId + "'", e);
        }
    }

    @Override
    public String providerName() { return PROVIDER_NAME; }

    public String getProjectId() { return projectId; }

    @Override
    public boolean topicExists(String topic) {
        try {
            topicAdmin.getTopic(TopicName.of(projectId, topic));
            return true;
        } catch (NotFoundException e) {
            return false;
        }
    }

    @Override
    public boolean subscriptionExists(String subscription) {
        try {
            subscriptionAdmin.getSubscription(SubscriptionName.of(projectId, subscription));
            return true;
        } catch (NotFoundException e) {
            return false;
        }
    }

    @Override
    public TopicRef createTopic(String topic) {
        topicAdmin.createTopic(TopicName.of(projectId, topic));
        log.info("Created Pub/Sub topic '{}' in project '{}'", topic, projectId);
        return new TopicRef(topic);
    }

    @Override
    public SubscriptionHandle createSubscription(String subscription, TopicRef topic, SubscriptionOptions options) {
        subscriptionAdmin.createSubscription(toSubscriptionRequest(subscription, topic, options));
        log.info("Created Pub/Sub subscription '{}' on topic '{}' {}", subscription, topic.name(), options);
        return new SubscriptionHandle(subscription, topic.name());
    }

    Subscription toSubscriptionRequest(String subscription, TopicRef topic, SubscriptionOptions options) {
        SubscriptionOptions opts = options != null ? options : SubscriptionOptions.defaults();
        Subscription.Builder request = Subscription.newBuilder()
                .setName(SubscriptionName.of(projectId, subscription).toString())
                .setTopic(TopicName.of(projectId, topic.name()).toString())
                .setRetainAckedMessages(opts.isRetainAckedMessages())
                .setEnableMessageOrdering(opts.isEnableMessageOrdering())
                .putAllLabels(opts.getLabels());
        if (opts.getAckDeadline() != null) {
            request.setAckDeadlineSeconds((int) opts.getAckDeadline().getSeconds());
        }
        if (opts.getMessageRetention() != null) {
            request.setMessageRetentionDuration(toProtoDuration(opts.getMessageRetention()));
        }
        if (opts.getFilter() != null) {
            request.setFilter(opts.getFilter());
        }
        return request.build();
    }

    @Override
    public void receive(SubscriptionHandle subscription, CancellationToken cancellation, RawMessageHandler handler) {
        Subscriber subscriber = newSubscriber(subscription, handler);
        cancellation.onCancel(subscriber::stopAsync);
        try {
            subscriber.startAsync().awaitRunning();
            log.debug("Streaming pull started for subscription '{}'", subscription.name());
            subscriber.awaitTerminated();
        } catch (IllegalStateException e) {
            if (cancellation.isCancelled()) {
                log.debug("Streaming pull for '{}' ended during cancellation: {}", subscription.name(), e.getMessage());
                return;
            }
            throw new ReceiveFailedException(subscription.name(), e.getCause() != null ? e.getCause() : e);
        }
    }

    Subscriber newSubscriber(SubscriptionHandle subscription, RawMessageHandler handler) {
        Subscriber.Builder builder = Subscriber.newBuilder(
                ProjectSubscriptionName.of(projectId, subscription.name()), receiverFor(handler));
        builder.setParallelPullCount(options.getParallelPullCount());
        builder.setExecutorProvider(InstantiatingExecutorProvider.newBuilder()
                .setExecutorThreadCount(options.getExecutorThreadCount())
                .build());
        builder.setFlowControlSettings(FlowControlSettings.newBuilder()
                .setMaxOutstandingElementCount(options.getMaxOutstandingMessages())
                .setMaxOutstandingRequestBytes(options.getMaxOutstandingBytes())
                .build());
        if (credentialsProvider != null) builder.setCredentialsProvider(credentialsProvider);
        if (channelProvider != null) builder.setChannelProvider(channelProvider);
        if (options.getEndpoint() != null) builder.setEndpoint(options.getEndpoint());
        return builder.build();
    }

    static MessageReceiver receiverFor(RawMessageHandler handler) {
        return (PubsubMessage message, AckReplyConsumer reply) ->
                handler.onMessage(new GoogleCloudRawMessage(message, reply));
    }

    @Override
    public void close() {
        RuntimeException failure = null;
        for (AutoCloseableClient client : List.<AutoCloseableClient>of(topicAdmin::close, subscriptionAdmin::close)) {
            try {
                client.close();
            } catch (RuntimeException e) {
                if (failure == null) failure = e;
                else failure.addSuppressed(e);
            }
        }
        if (emulatorChannel != null) {
            emulatorChannel.shutdown();
            try {
                if (!emulatorChannel.awaitTermination(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    emulatorChannel.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                emulatorChannel.shutdownNow();
            }
        }
        if (failure != null) {
            throw new SubBridgeException("SUB_CLOSE_FAILED", "could not close Google Cloud Pub/Sub clients", failure);
        }
        log.debug("Google Cloud Pub/Sub gateway for project '{}' closed", projectId);
    }

    private static CredentialsProvider loadCredentials(String path) throws IOException {
        try (InputStream in = Files.newInputStream(Path.of(path))) {
            GoogleCredentials credentials = GoogleCredentials.fromStream(in).createScoped(List.of(PUBSUB_SCOPE));
            return FixedCredentialsProvider.create(credentials);
        }
    }

    private static com.google.protobuf.Duration toProtoDuration(Duration duration) {
        return com.google.protobuf.Duration.newBuilder()
                .setSeconds(duration.getSeconds())
                .setNanos(duration.getNano())
                .build();
    }

    @FunctionalInterface
    private interface AutoCloseableClient {
        void close();
    }
}
