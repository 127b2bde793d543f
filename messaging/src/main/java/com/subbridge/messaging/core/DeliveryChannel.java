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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-subscription output queue with unbuffered hand-off semantics.
 *
 * <p>The producer side ({@link #offer(Message)}) blocks until a consumer has taken the message
 * or the channel is closed. Concurrent producers are served in the order they called
 * {@code offer}, so the channel never reorders a subscription's messages.
 *
 * <p>Consumers call {@link #receive()} or {@link #receive(long, TimeUnit)}; both return
 * {@code null} once the channel is closed, which is the only end-of-stream signal a subscription
 * has.
 *
 * <p>The channel is closed by the subscriber when the subscription shuts down or its receive
 * session ends. A consumer may close it too, after which pending and future deliveries are
 * nacked by the delivery loop.
 */
public class DeliveryChannel {

    private final String topic;
    private final ReentrantLock lock = new ReentrantLock(true);
    private final Condition available = lock.newCondition();
    private final Condition taken = lock.newCondition();

    /** Blocked producers, oldest first. */
    private final Deque<Slot> waiting = new ArrayDeque<>();
    private boolean closed;

    public DeliveryChannel(String topic) {
        this.topic = topic;
    }

    public String getTopic() { return topic; }

    /**
     * Hand a message to a consumer.
     *
     * @return true once a consumer has taken the message, false if the channel closed first
     * @throws InterruptedException if interrupted while waiting; the message is withdrawn
     */
    public boolean offer(Message message) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            if (closed) return false;

            Slot slot = new Slot(message);
            waiting.addLast(slot);
            available.signal();
            try {
                while (!slot.taken && !closed) {
                    taken.await();
                }
            } catch (InterruptedException e) {
                if (!slot.taken) {
                    waiting.remove(slot);
                    throw e;
                }
                Thread.currentThread().interrupt();
            }
            if (!slot.taken) {
                waiting.remove(slot);
                return false;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait for the next message.
     *
     * @return the message, or null once the channel is closed
     */
    public Message receive() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (waiting.isEmpty() && !closed) {
                available.await();
            }
            return takeOldest();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait up to {@code timeout} for the next message.
     *
     * @return the message, or null on timeout or once the channel is closed
     */
    public Message receive(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (waiting.isEmpty() && !closed) {
                if (nanos <= 0) return null;
                nanos = available.awaitNanos(nanos);
            }
            return takeOldest();
        } finally {
            lock.unlock();
        }
    }

    public void close() {
        lock.lock();
        try {
            closed = true;
            available.signalAll();
            taken.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /** Number of producers currently blocked in {@link #offer(Message)}. */
    public int waitingOffers() {
        lock.lock();
        try {
            return waiting.size();
        } finally {
            lock.unlock();
        }
    }

    private Message takeOldest() {
        if (closed) return null;
        Slot slot = waiting.pollFirst();
        slot.taken = true;
        taken.signalAll();
        return slot.message;
    }

    private static final class Slot {
        final Message message;
        boolean taken;

        Slot(Message message) {
            this.message = message;
        }
    }
}
