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

public class TopicMissingException extends SubBridgeException {
    private final String topic;

    public TopicMissingException(String topic) {
        super("SUB_TOPIC_MISSING", "topic does not exist: " + topic);
        this.topic = topic;
    }

    public String getTopic() { return topic; }
}
