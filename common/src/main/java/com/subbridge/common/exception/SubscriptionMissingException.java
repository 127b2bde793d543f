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

public class SubscriptionMissingException extends SubBridgeException {
    private final String subscriptionName;

    public SubscriptionMissingException(String subscriptionName) {
        super("SUB_SUBSCRIPTION_MISSING", "subscription does not exist: " + subscriptionName);
        this.subscriptionName = subscriptionName;
    }

    public String getSubscriptionName() { return subscriptionName; }
}
