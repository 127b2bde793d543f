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

import com.subbridge.common.exception.SubBridgeException;
import com.subbridge.messaging.core.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Phaser;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the closed flag, the root cancellation token and the completion barrier of a subscriber.
 *
 * <p>Delivery loops {@link #enlist()} before they start and {@link #release()} when they exit.
 * {@link #close()} cancels the root token and waits on the barrier until every enlisted loop has
 * released. Enlisting and closing are serialized so no loop can slip in after the drain starts.
 * {@link #beginClose()} and {@link #awaitDrained()} split the two steps for callers that must
 * release resources even when the wait is interrupted.
 */
public class ShutdownCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ShutdownCoordinator.class);

    private final CancellationToken root = CancellationToken.create();
    /** One party for the coordinator itself plus one per running loop. */
    private final Phaser barrier = new Phaser(1);
    private final ReentrantLock enlistLock = new ReentrantLock();
    private final AtomicInteger active = new AtomicInteger();
    private volatile boolean closed;
    private volatile int drainPhase;

    /** Cancellation scope for one subscription; fires when the subscriber closes. */
    public CancellationToken newScope() {
        return root.child();
    }

    /**
     * Register a delivery loop with the completion barrier.
     *
     * @return false if the subscriber is already closed; the loop must not start
     */
    public boolean enlist() {
        enlistLock.lock();
        try {
            if (closed) return false;
            barrier.register();
            active.incrementAndGet();
            return true;
        } finally {
            enlistLock.unlock();
        }
    }

    public void release() {
        active.decrementAndGet();
        barrier.arriveAndDeregister();
    }

    public boolean isClosed() {
        return closed;
    }

    public int activeLoops() {
        return active.get();
    }

    /**
     * Close and wait for every enlisted loop to exit.
     *
     * @return true on the first call, false if already closed
     * @throws SubBridgeException with code {@code SUB_INTERRUPTED} if interrupted while draining
     */
    public boolean close() {
        if (!beginClose()) return false;
        awaitDrained();
        return true;
    }

    /**
     * Flip the closed flag and cancel every scope without waiting.
     *
     * @return true on the first call, false if already closed
     */
    public boolean beginClose() {
        enlistLock.lock();
        try {
            if (closed) return false;
            closed = true;
        } finally {
            enlistLock.unlock();
        }
        root.cancel();
        drainPhase = barrier.arrive();
        return true;
    }

    /**
     * Wait until every enlisted loop has released. Only meaningful after {@link #beginClose()}.
     *
     * @throws SubBridgeException with code {@code SUB_INTERRUPTED} if interrupted while draining
     */
    public void awaitDrained() {
        log.debug("Waiting for {} delivery loop(s) to finish", active.get());
        try {
            barrier.awaitAdvanceInterruptibly(drainPhase);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SubBridgeException("SUB_INTERRUPTED", "interrupted while waiting for delivery loops to finish", e);
        }
    }
}
