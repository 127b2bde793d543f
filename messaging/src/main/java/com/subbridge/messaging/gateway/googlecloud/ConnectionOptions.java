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

/**
 * Transport-level settings for the Google Cloud Pub/Sub connection.
 *
 * <p>When {@code emulatorHost} is set the gateway talks plaintext gRPC to a local emulator and
 * sends no credentials. Otherwise {@code credentialsFile} (a service account key) is used if
 * given, falling back to application default credentials.
 *
 * <p>{@code executorThreadCount} sizes the pool that runs message callbacks. The default of one
 * thread hands messages on in the order each pull stream delivers them.
 */
public final class ConnectionOptions {

    private final String emulatorHost;
    private final String endpoint;
    private final String credentialsFile;
    private final int parallelPullCount;
    private final int executorThreadCount;
    private final long maxOutstandingMessages;
    private final long maxOutstandingBytes;

    private ConnectionOptions(Builder b) {
        this.emulatorHost = blankToNull(b.emulatorHost);
        this.endpoint = blankToNull(b.endpoint);
        this.credentialsFile = blankToNull(b.credentialsFile);
        this.parallelPullCount = b.parallelPullCount;
        this.executorThreadCount = b.executorThreadCount;
        this.maxOutstandingMessages = b.maxOutstandingMessages;
        this.maxOutstandingBytes = b.maxOutstandingBytes;
    }

    public static ConnectionOptions defaults() { return builder().build(); }

    public static Builder builder() { return new Builder(); }

    public String getEmulatorHost() { return emulatorHost; }
    public String getEndpoint() { return endpoint; }
    public String getCredentialsFile() { return credentialsFile; }
    public int getParallelPullCount() { return parallelPullCount; }
    public int getExecutorThreadCount() { return executorThreadCount; }
    public long getMaxOutstandingMessages() { return maxOutstandingMessages; }
    public long getMaxOutstandingBytes() { return maxOutstandingBytes; }

    @Override
    public String toString() {
        return "ConnectionOptions{" +
               (emulatorHost != null ? "emulator=" + emulatorHost + ", " : "") +
               (endpoint != null ? "endpoint=" + endpoint + ", " : "") +
               (credentialsFile != null ? "credentials=file, " : "") +
               "parallelPull=" + parallelPullCount +
               ", executorThreads=" + executorThreadCount +
               ", maxOutstanding=" + maxOutstandingMessages + "msg/" + maxOutstandingBytes + "B}";
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public static class Builder {
        private String emulatorHost;
        private String endpoint;
        private String credentialsFile;
        private int parallelPullCount = 1;
        private int executorThreadCount = 1;
        private long maxOutstandingMessages = 1000L;
        private long maxOutstandingBytes = 100L * 1024L * 1024L;

        public Builder emulatorHost(String host) {
            this.emulatorHost = host; return this;
        }
        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint; return this;
        }
        public Builder credentialsFile(String path) {
            this.credentialsFile = path; return this;
        }
        public Builder parallelPullCount(int count) {
            this.parallelPullCount = count; return this;
        }
        public Builder executorThreadCount(int count) {
            this.executorThreadCount = count; return this;
        }
        public Builder maxOutstandingMessages(long count) {
            this.maxOutstandingMessages = count; return this;
        }
        public Builder maxOutstandingBytes(long bytes) {
            this.maxOutstandingBytes = bytes; return this;
        }

        public ConnectionOptions build() {
            if (parallelPullCount < 1) {
                throw new IllegalStateException("parallelPullCount must be at least 1");
            }
            if (executorThreadCount < 1) {
                throw new IllegalStateException("executorThreadCount must be at least 1");
            }
            if (maxOutstandingMessages < 1 || maxOutstandingBytes < 1) {
                throw new IllegalStateException("flow control limits must be positive");
            }
            return new ConnectionOptions(this);
        }
    }
}
