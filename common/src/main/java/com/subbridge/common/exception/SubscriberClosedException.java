/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.subbridge.common.exception;

/**
 * Thrown by subscribe calls made after the subscriber was closed. Not retryable.
 */
public class SubscriberClosedException extends SubBridgeException {
    public SubscriberClosedException() {
        super("SUB_CLOSED", "subscriber is closed");
    }
}
