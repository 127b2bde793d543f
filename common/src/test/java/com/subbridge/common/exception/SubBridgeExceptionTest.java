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

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class SubBridgeExceptionTest {

    @Test
    void errorCodesIdentifyTheFailureKind() {
        assertThat(new SubscriberClosedException().getErrorCode()).isEqualTo("SUB_CLOSED");
        assertThat(new SubscriptionMissingException("orders-sub").getErrorCode()).isEqualTo("SUB_SUBSCRIPTION_MISSING");
        assertThat(new TopicMissingException("orders").getErrorCode()).isEqualTo("SUB_TOPIC_MISSING");
        assertThat(new DecodeFailedException("bad").getErrorCode()).isEqualTo("SUB_DECODE_FAILED");
        assertThat(new SubBridgeException("plain").getErrorCode()).isEqualTo("SUB_GENERIC");
    }

    @Test
    void provisioningFailureKeepsCause() {
        IOException rpc = new IOException("deadline exceeded");
        ProvisioningFailedException e = new ProvisioningFailedException("could not check if topic orders exists", rpc);

        assertThat(e.getCause()).isSameAs(rpc);
        assertThat(e.getErrorCode()).isEqualTo("SUB_PROVISIONING_FAILED");
    }

    @Test
    void missingResourcesExposeTheirName() {
        assertThat(new SubscriptionMissingException("orders-sub").getSubscriptionName()).isEqualTo("orders-sub");
        assertThat(new TopicMissingException("orders").getTopic()).isEqualTo("orders");
        assertThat(new ReceiveFailedException("orders-sub", new IllegalStateException()).getMessage())
                .contains("orders-sub");
    }
}
