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

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Domain unit of delivery handed to consumers of a {@link DeliveryChannel}.
 *
 * <p>Each message carries two one-shot signals. The consumer settles a message by calling
 * exactly one of {@link #ack()} or {@link #nack()}; the first call wins:
 * <ul>
 *   <li>{@code ack()} after {@code nack()} returns false, and vice versa</li>
 *   <li>repeating the winning call is a no-op returning true</li>
 * </ul>
 *
 * <p>Instances are thread-safe.
 */
public class Message {

    private enum State { PENDING, ACKED, NACKED }

    private final String uuid;
    private final byte[] payload;
    private final Map<String, String> metadata;

    private final AtomicReference<State> state = new AtomicReference<>(State.PENDING);
    private final CompletableFuture<Void> acked = new CompletableFuture<>();
    private final CompletableFuture<Void> nacked = new CompletableFuture<>();

    public Message(String uuid, byte[] payload) {
        this(uuid, payload, Collections.emptyMap());
    }

    public Message(String uuid, byte[] payload, Map<String, String> metadata) {
        this.uuid = Objects.requireNonNull(uuid, "uuid must not be null");
        this.payload = payload != null ? payload.clone() : new byte[0];
        this.metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Collections.emptyMap();
    }

    /** Convenience factory generating a random uuid. */
    public static Message of(String payload) {
        return new Message(UUID.randomUUID().toString(), payload.getBytes(StandardCharsets.UTF_8));
    }

    public String getUuid() { return uuid; }
    public byte[] getPayload() { return payload.clone(); }
    public String getPayloadAsString() { return new String(payload, StandardCharsets.UTF_8); }
    public Map<String, String> getMetadata() { return metadata; }
    public String getMetadata(String key) { return metadata.get(key); }

    /**
     * Mark the message as successfully processed.
     *
     * @return false if the message was already nacked
     */
    public boolean ack() {
        if (state.compareAndSet(State.PENDING, State.ACKED)) {
            acked.complete(null);
            return true;
        }
        return state.get() == State.ACKED;
    }

    /**
     * Mark the message as not processed; the broker will redeliver it.
     *
     * @return false if the message was already acked
     */
    public boolean nack() {
        if (state.compareAndSet(State.PENDING, State.NACKED)) {
            nacked.complete(null);
            return true;
        }
        return state.get() == State.NACKED;
    }

    public boolean isAcked() { return state.get() == State.ACKED; }
    public boolean isNacked() { return state.get() == State.NACKED; }
    public boolean isSettled() { return state.get() != State.PENDING; }

    /** Completes once {@link #ack()} wins. The returned future is read-only for callers. */
    public CompletableFuture<Void> acked() { return acked.copy(); }

    /** Completes once {@link #nack()} wins. */
    public CompletableFuture<Void> nacked() { return nacked.copy(); }

    @Override
    public String toString() {
        return "Message{uuid=" + uuid + ", bytes=" + payload.length + ", metadata=" + metadata + ", state=" + state.get() + "}";
    }
}
