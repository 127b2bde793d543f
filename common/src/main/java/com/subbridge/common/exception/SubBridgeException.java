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
 * Base exception for all SubBridge errors.
 * Every subclass carries a stable error code so callers can branch without string matching.
 */
public class SubBridgeException extends RuntimeException {
    private final String errorCode;

    public SubBridgeException(String message) {
        super(message);
        this.errorCode = "SUB_GENERIC";
    }

    public SubBridgeException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public SubBridgeException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() { return errorCode; }
}
