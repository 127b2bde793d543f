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
 * Wraps a broker RPC failure raised while checking or creating topics and subscriptions.
 * The original failure is always available through {@link #getCause()}.
 */
public class ProvisioningFailedException extends SubBridgeException {
    public ProvisioningFailedException(String message, Throwable cause) {
        super("SUB_PROVISIONING_FAILED", message, cause);
    }
}
