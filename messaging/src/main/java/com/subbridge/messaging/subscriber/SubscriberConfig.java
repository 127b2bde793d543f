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

import com.subbridge.common.util.ConfigPropertyResolver;
import com.subbridge.messaging.core.DefaultMessageCodec;
import com.subbridge.messaging.core.JsonEnvelopeCodec;
import com.subbridge.messaging.core.MessageCodec;
import com.subbridge.messaging.gateway.SubscriptionOptions;
import com.subbridge.messaging.gateway.googlecloud.ConnectionOptions;

import java.time.Duration;
import java.util.Properties;

/**
 * Configuration for the {@link PubSubSubscriber}.
 *
 * <p>Usage with builder pattern:
 * <pre>{@code
 *   SubscriberConfig config = SubscriberConfig.builder()
 *       .projectId("my-project")
 *       .subscriptionNameFunction(SubscriptionNameFunction.withSuffix("_billing"))
 *       .subscriptionOptions(SubscriptionOptions.builder()
 *           .ackDeadline(Duration.ofSeconds(30))
 *           .build())
 *       .build();
 * }</pre>
 *
 * <p>Or from properties (placeholders like {@code ${GCP_PROJECT:local}} are resolved):
 * <pre>{@code
 *   SubscriberConfig config = SubscriberConfig.fromProperties(properties);
 *   SubscriberConfig config = SubscriberConfig.fromClasspath("subbridge.properties");
 * }</pre>
 */
public class SubscriberConfig {

    public static final String PREFIX = "subbridge.subscriber.";

    static final long MIN_ACK_DEADLINE_SECONDS = 10;
    static final long MAX_ACK_DEADLINE_SECONDS = 600;

    private String subscriberName = "subbridge-subscriber";
    private String projectId;
    private SubscriptionNameFunction subscriptionNameFunction = SubscriptionNameFunction.identity();
    private boolean doNotCreateSubscriptionIfMissing = false;
    private boolean doNotCreateTopicIfMissing = false;
    private SubscriptionOptions subscriptionOptions = SubscriptionOptions.defaults();
    private ConnectionOptions connectionOptions = ConnectionOptions.defaults();
    private MessageCodec codec = new DefaultMessageCodec();

    public SubscriberConfig() {}

    // ========== Builder ==========

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private final SubscriberConfig config = new SubscriberConfig();

        public Builder subscriberName(String name) {
            config.subscriberName = name; return this;
        }
        public Builder projectId(String projectId) {
            config.projectId = projectId; return this;
        }
        public Builder subscriptionNameFunction(SubscriptionNameFunction fn) {
            config.subscriptionNameFunction = fn; return this;
        }
        public Builder doNotCreateSubscriptionIfMissing(boolean flag) {
            config.doNotCreateSubscriptionIfMissing = flag; return this;
        }
        public Builder doNotCreateTopicIfMissing(boolean flag) {
            config.doNotCreateTopicIfMissing = flag; return this;
        }
        public Builder subscriptionOptions(SubscriptionOptions options) {
            config.subscriptionOptions = options; return this;
        }
        public Builder connectionOptions(ConnectionOptions options) {
            config.connectionOptions = options; return this;
        }
        public Builder codec(MessageCodec codec) {
            config.codec = codec; return this;
        }

        public SubscriberConfig build() {
            if (config.subscriptionNameFunction == null) {
                throw new IllegalStateException("invalid config: subscriptionNameFunction is not set");
            }
            if (config.codec == null) {
                throw new IllegalStateException("invalid config: codec is not set");
            }
            if (config.subscriptionOptions == null) {
                config.subscriptionOptions = SubscriptionOptions.defaults();
            }
            if (config.connectionOptions == null) {
                config.connectionOptions = ConnectionOptions.defaults();
            }
            Duration ackDeadline = config.subscriptionOptions.getAckDeadline();
            if (ackDeadline != null && (ackDeadline.getSeconds() < MIN_ACK_DEADLINE_SECONDS
                    || ackDeadline.getSeconds() > MAX_ACK_DEADLINE_SECONDS)) {
                throw new IllegalStateException("invalid config: ack deadline must be between "
                        + MIN_ACK_DEADLINE_SECONDS + "s and " + MAX_ACK_DEADLINE_SECONDS + "s, got " + ackDeadline);
            }
            return config;
        }
    }

    // ========== Factory from properties ==========

    /**
     * Build configuration from a Properties object. Recognized keys (all under
     * {@code subbridge.subscriber.}):
     *   name, project-id, subscription-prefix, subscription-suffix,
     *   do-not-create-subscription-if-missing, do-not-create-topic-if-missing,
     *   ack-deadline-seconds, message-retention-seconds, retain-acked-messages,
     *   enable-message-ordering, filter, label.&lt;key&gt;, codec (default|json),
     *   emulator-host, endpoint, credentials-file, parallel-pull-count,
     *   executor-thread-count, max-outstanding-messages, max-outstanding-bytes
     *
     * <p>The emulator host falls back to the {@code PUBSUB_EMULATOR_HOST} environment variable.
     */
    public static SubscriberConfig fromProperties(Properties props) {
        ConfigPropertyResolver resolver = new ConfigPropertyResolver(props);
        Builder b = builder();

        b.subscriberName(resolver.get(PREFIX + "name", "subbridge-subscriber"))
         .projectId(resolver.get(PREFIX + "project-id", null))
         .doNotCreateSubscriptionIfMissing(Boolean.parseBoolean(
                 resolver.get(PREFIX + "do-not-create-subscription-if-missing", "false")))
         .doNotCreateTopicIfMissing(Boolean.parseBoolean(
                 resolver.get(PREFIX + "do-not-create-topic-if-missing", "false")));

        b.subscriptionNameFunction(namingFunction(
                resolver.get(PREFIX + "subscription-prefix", ""),
                resolver.get(PREFIX + "subscription-suffix", "")));

        SubscriptionOptions.Builder options = SubscriptionOptions.builder()
                .retainAckedMessages(Boolean.parseBoolean(resolver.get(PREFIX + "retain-acked-messages", "false")))
                .enableMessageOrdering(Boolean.parseBoolean(resolver.get(PREFIX + "enable-message-ordering", "false")))
                .filter(resolver.get(PREFIX + "filter", null));
        String ackDeadline = resolver.get(PREFIX + "ack-deadline-seconds", null);
        if (ackDeadline != null && !ackDeadline.isBlank()) {
            options.ackDeadline(Duration.ofSeconds(Long.parseLong(ackDeadline.trim())));
        }
        String retention = resolver.get(PREFIX + "message-retention-seconds", null);
        if (retention != null && !retention.isBlank()) {
            options.messageRetention(Duration.ofSeconds(Long.parseLong(retention.trim())));
        }
        String labelPrefix = PREFIX + "label.";
        for (String key : props.stringPropertyNames()) {
            if (key.startsWith(labelPrefix)) {
                options.label(key.substring(labelPrefix.length()), resolver.get(key, ""));
            }
        }
        b.subscriptionOptions(options.build());

        b.connectionOptions(ConnectionOptions.builder()
                .emulatorHost(resolver.get(PREFIX + "emulator-host", resolver.resolve("${PUBSUB_EMULATOR_HOST:}")))
                .endpoint(resolver.get(PREFIX + "endpoint", null))
                .credentialsFile(resolver.get(PREFIX + "credentials-file", null))
                .parallelPullCount(Integer.parseInt(resolver.get(PREFIX + "parallel-pull-count", "1")))
                .executorThreadCount(Integer.parseInt(resolver.get(PREFIX + "executor-thread-count", "1")))
                .maxOutstandingMessages(Long.parseLong(resolver.get(PREFIX + "max-outstanding-messages", "1000")))
                .maxOutstandingBytes(Long.parseLong(resolver.get(PREFIX + "max-outstanding-bytes", "104857600")))
                .build());

        b.codec(codecFor(resolver.get(PREFIX + "codec", "default")));
        return b.build();
    }

    /**
     * Build configuration from a properties file on the classpath. A missing resource yields
     * the defaults.
     */
    public static SubscriberConfig fromClasspath(String resource) {
        Properties props = new Properties();
        new ConfigPropertyResolver(props).loadClasspathProperties(resource);
        return fromProperties(props);
    }

    static SubscriptionNameFunction namingFunction(String prefix, String suffix) {
        SubscriptionNameFunction fn = SubscriptionNameFunction.identity();
        if (prefix != null && !prefix.isEmpty()) fn = fn.andThen(SubscriptionNameFunction.withPrefix(prefix));
        if (suffix != null && !suffix.isEmpty()) fn = fn.andThen(SubscriptionNameFunction.withSuffix(suffix));
        return fn;
    }

    static MessageCodec codecFor(String name) {
        switch (name.trim().toLowerCase()) {
            case "default": return new DefaultMessageCodec();
            case "json": return new JsonEnvelopeCodec();
            default:
                throw new IllegalStateException("invalid config: unknown codec '" + name + "', expected default or json");
        }
    }

    // ========== Getters ==========

    public String getSubscriberName() { return subscriberName; }
    public String getProjectId() { return projectId; }
    public SubscriptionNameFunction getSubscriptionNameFunction() { return subscriptionNameFunction; }
    public boolean isDoNotCreateSubscriptionIfMissing() { return doNotCreateSubscriptionIfMissing; }
    public boolean isDoNotCreateTopicIfMissing() { return doNotCreateTopicIfMissing; }
    public SubscriptionOptions getSubscriptionOptions() { return subscriptionOptions; }
    public ConnectionOptions getConnectionOptions() { return connectionOptions; }
    public MessageCodec getCodec() { return codec; }

    @Override
    public String toString() {
        return "SubscriberConfig{name=" + subscriberName +
               ", project=" + projectId +
               ", createSubscription=" + !doNotCreateSubscriptionIfMissing +
               ", createTopic=" + !doNotCreateTopicIfMissing +
               ", codec=" + codec.getClass().getSimpleName() +
               ", " + subscriptionOptions + ", " + connectionOptions + "}";
    }
}
