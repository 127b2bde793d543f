/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.subbridge.messaging.subscriber;

import com.subbridge.messaging.gateway.BrokerGateway;
import com.subbridge.messaging.gateway.SubscriptionOptions;
import com.subbridge.messaging.gateway.googlecloud.ConnectionOptions;
import com.subbridge.messaging.gateway.googlecloud.GoogleCloudBrokerGateway;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Spring auto-configuration that creates a {@link PubSubSubscriber} bean from application
 * properties when {@code subbridge.subscriber.enabled=true}.
 *
 * <p>Configuration properties (all under {@code subbridge.subscriber.*}):
 * <pre>
 *   subbridge.subscriber.enabled=true
 *   subbridge.subscriber.name=billing
 *   subbridge.subscriber.project-id=my-project
 *   subbridge.subscriber.subscription-prefix=
 *   subbridge.subscriber.subscription-suffix=_billing
 *   subbridge.subscriber.do-not-create-subscription-if-missing=false
 *   subbridge.subscriber.do-not-create-topic-if-missing=false
 *   subbridge.subscriber.ack-deadline-seconds=30
 *   subbridge.subscriber.message-retention-seconds=604800
 *   subbridge.subscriber.retain-acked-messages=false
 *   subbridge.subscriber.enable-message-ordering=false
 *   subbridge.subscriber.filter=attributes.region = "eu"
 *   subbridge.subscriber.codec=default
 *
 *   # Connection
 *   subbridge.subscriber.emulator-host=localhost:8085
 *   subbridge.subscriber.endpoint=
 *   subbridge.subscriber.credentials-file=/etc/keys/pubsub.json
 *   subbridge.subscriber.parallel-pull-count=1
 *   subbridge.subscriber.executor-thread-count=1
 *   subbridge.subscriber.max-outstanding-messages=1000
 *   subbridge.subscriber.max-outstanding-bytes=104857600
 * </pre>
 *
 * <p>A {@link BrokerGateway} bean defined by the application replaces the Google Cloud one.
 * The subscriber owns the gateway and closes both via {@code @PreDestroy}.
 */
@Configuration
@ConditionalOnProperty(name = "subbridge.subscriber.enabled", havingValue = "true")
public class SubscriberAutoConfig {

    private static final Logger log = LoggerFactory.getLogger(SubscriberAutoConfig.class);

    @Value("${subbridge.subscriber.name:subbridge-subscriber}")
    private String name;
    @Value("${subbridge.subscriber.project-id:#{null}}")
    private String projectId;
    @Value("${subbridge.subscriber.subscription-prefix:}")
    private String subscriptionPrefix;
    @Value("${subbridge.subscriber.subscription-suffix:}")
    private String subscriptionSuffix;
    @Value("${subbridge.subscriber.do-not-create-subscription-if-missing:false}")
    private boolean doNotCreateSubscriptionIfMissing;
    @Value("${subbridge.subscriber.do-not-create-topic-if-missing:false}")
    private boolean doNotCreateTopicIfMissing;
    @Value("${subbridge.subscriber.ack-deadline-seconds:0}")
    private long ackDeadlineSeconds;
    @Value("${subbridge.subscriber.message-retention-seconds:0}")
    private long messageRetentionSeconds;
    @Value("${subbridge.subscriber.retain-acked-messages:false}")
    private boolean retainAckedMessages;
    @Value("${subbridge.subscriber.enable-message-ordering:false}")
    private boolean enableMessageOrdering;
    @Value("${subbridge.subscriber.filter:#{null}}")
    private String filter;
    @Value("${subbridge.subscriber.codec:default}")
    private String codec;

    @Value("${subbridge.subscriber.emulator-host:${PUBSUB_EMULATOR_HOST:}}")
    private String emulatorHost;
    @Value("${subbridge.subscriber.endpoint:#{null}}")
    private String endpoint;
    @Value("${subbridge.subscriber.credentials-file:#{null}}")
    private String credentialsFile;
    @Value("${subbridge.subscriber.parallel-pull-count:1}")
    private int parallelPullCount;
    @Value("${subbridge.subscriber.executor-thread-count:1}")
    private int executorThreadCount;
    @Value("${subbridge.subscriber.max-outstanding-messages:1000}")
    private long maxOutstandingMessages;
    @Value("${subbridge.subscriber.max-outstanding-bytes:104857600}")
    private long maxOutstandingBytes;

    private PubSubSubscriber subscriber;

    @Bean
    public SubscriberConfig subscriberConfig() {
        SubscriptionOptions.Builder options = SubscriptionOptions.builder()
                .retainAckedMessages(retainAckedMessages)
                .enableMessageOrdering(enableMessageOrdering)
                .filter(filter);
        if (ackDeadlineSeconds > 0) options.ackDeadline(Duration.ofSeconds(ackDeadlineSeconds));
        if (messageRetentionSeconds > 0) options.messageRetention(Duration.ofSeconds(messageRetentionSeconds));

        return SubscriberConfig.builder()
                .subscriberName(name)
                .projectId(projectId)
                .subscriptionNameFunction(SubscriberConfig.namingFunction(subscriptionPrefix, subscriptionSuffix))
                .doNotCreateSubscriptionIfMissing(doNotCreateSubscriptionIfMissing)
                .doNotCreateTopicIfMissing(doNotCreateTopicIfMissing)
                .subscriptionOptions(options.build())
                .connectionOptions(ConnectionOptions.builder()
                        .emulatorHost(emulatorHost)
                        .endpoint(endpoint)
                        .credentialsFile(credentialsFile)
                        .parallelPullCount(parallelPullCount)
                        .executorThreadCount(executorThreadCount)
                        .maxOutstandingMessages(maxOutstandingMessages)
                        .maxOutstandingBytes(maxOutstandingBytes)
                        .build())
                .codec(SubscriberConfig.codecFor(codec))
                .build();
    }

    /** Closed by the subscriber, not by the container. */
    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean
    public BrokerGateway brokerGateway(SubscriberConfig subscriberConfig) {
        return GoogleCloudBrokerGateway.connect(subscriberConfig.getProjectId(), subscriberConfig.getConnectionOptions());
    }

    @Bean(destroyMethod = "")
    public PubSubSubscriber pubSubSubscriber(SubscriberConfig subscriberConfig, BrokerGateway brokerGateway) {
        subscriber = new PubSubSubscriber(subscriberConfig, brokerGateway);
        log.info("PubSubSubscriber bean created: {}", subscriberConfig);
        return subscriber;
    }

    @PreDestroy
    public void destroy() {
        if (subscriber != null && !subscriber.isClosed()) {
            subscriber.close();
        }
    }
}
