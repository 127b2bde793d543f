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

import java.util.concurrent.CompletableFuture;

/**
 * One-shot cancellation signal shared by the tasks of a subscriber.
 *
 * <p>A token is never reset. {@link #child()} derives a scope that is cancelled together with its
 * parent but can also be cancelled on its own without affecting the parent.
 *
 * <p>Callbacks registered with {@link #onCancel(Runnable)} run on the thread calling
 * {@link #cancel()}, before it returns; if the token is already cancelled they run immediately
 * on the registering thread.
 */
public final class CancellationToken {

    private final CompletableFuture<Void> cancelled = new CompletableFuture<>();

    private CancellationToken() {}

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public CancellationToken child() {
        CancellationToken child = new CancellationToken();
        onCancel(child::cancel);
        return child;
    }

    /**
     * @return true only for the call that actually cancelled the token
     */
    public boolean cancel() {
        return cancelled.complete(null);
    }

    public boolean isCancelled() {
        return cancelled.isDone();
    }

    public void onCancel(Runnable action) {
        cancelled.thenRun(action);
    }

    /** Future completing on cancellation, suitable for {@code CompletableFuture.anyOf} races. */
    public CompletableFuture<Void> whenCancelled() {
        return cancelled.copy();
    }
}
