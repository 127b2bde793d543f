/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.subbridge.messaging.gateway;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Broker-side settings applied when a subscription is created. Ignored for subscriptions that
 * already exist. Null or empty values leave the broker default in place.
 *
 * <pre>{@code
 *   SubscriptionOptions options = SubscriptionOptions.builder()
 *       .ackDeadline(Duration.ofSeconds(30))
 *       .messageRetention(Duration.ofDays(3))
 *       .label("team", "payments")
 *       .build();
 * }</pre>
 */
public final class SubscriptionOptions {

    private final Duration ackDeadline;
    private final Duration messageRetention;
    private final boolean retainAckedMessages;
    private final boolean enableMessageOrdering;
    private final String filter;
    private final Map<String, String> labels;

    private SubscriptionOptions(Builder b) {
        this.ackDeadline = b.ackDeadline;
        this.messageRetention = b.messageRetention;
        this.retainAckedMessages = b.retainAckedMessages;
        this.enableMessageOrdering = b.enableMessageOrdering;
        this.filter = b.filter;
        this.labels = Collections.unmodifiableMap(new LinkedHashMap<>(b.labels));
    }

    public static SubscriptionOptions defaults() { return builder().build(); }

    public static Builder builder() { return new Builder(); }

    public Duration getAckDeadline() { return ackDeadline; }
    public Duration getMessageRetention() { return messageRetention; }
    public boolean isRetainAckedMessages() { return retainAckedMessages; }
    public boolean isEnableMessageOrdering() { return enableMessageOrdering; }
    public String getFilter() { return filter; }
    public Map<String, String> getLabels() { return labels; }

    @Override
    public String toString() {
        return "SubscriptionOptions{ackDeadline=" + ackDeadline + ", retention=" + messageRetention +
               ", retainAcked=" + retainAckedMessages + ", ordering=" + enableMessageOrdering +
               (filter != null ? ", filter=" + filter : "") + ", labels=" + labels + "}";
    }

    public static class Builder {
        private Duration ackDeadline;
        private Duration messageRetention;
        private boolean retainAckedMessages;
        private boolean enableMessageOrdering;
        private String filter;
        private final Map<String, String> labels = new LinkedHashMap<>();

        public Builder ackDeadline(Duration ackDeadline) {
            this.ackDeadline = ackDeadline; return this;
        }
        public Builder messageRetention(Duration retention) {
            this.messageRetention = retention; return this;
        }
        public Builder retainAckedMessages(boolean retain) {
            this.retainAckedMessages = retain; return this;
        }
        public Builder enableMessageOrdering(boolean ordering) {
            this.enableMessageOrdering = ordering; return this;
        }
        public Builder filter(String filter) {
            this.filter = filter; return this;
        }
        public Builder label(String key, String value) {
            this.labels.put(key, value); return this;
        }

        public SubscriptionOptions build() {
            return new SubscriptionOptions(this);
        }
    }
}
