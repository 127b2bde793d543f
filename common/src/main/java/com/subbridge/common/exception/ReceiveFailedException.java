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

public class ReceiveFailedException extends SubBridgeException {
    public ReceiveFailedException(String subscriptionName, Throwable cause) {
        super("SUB_RECEIVE_FAILED",
              "receive session for subscription '" + subscriptionName + "' terminated abnormally", cause);
    }
}
