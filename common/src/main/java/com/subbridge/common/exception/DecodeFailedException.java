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
 * Raised by message codecs. Never reaches a consumer; the delivery loop nacks the raw message.
 */
public class DecodeFailedException extends SubBridgeException {
    public DecodeFailedException(String message) {
        super("SUB_DECODE_FAILED", message);
    }

    public DecodeFailedException(String message, Throwable cause) {
        super("SUB_DECODE_FAILED", message, cause);
    }
}
