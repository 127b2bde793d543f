/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
/**
 * SubBridge exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend
 * {@link com.subbridge.common.exception.SubBridgeException}, which carries an error code:
 * <ul>
 *   <li>{@code SUB_CLOSED} - subscribe after close</li>
 *   <li>{@code SUB_SUBSCRIPTION_MISSING} / {@code SUB_TOPIC_MISSING} - auto-creation disabled</li>
 *   <li>{@code SUB_PROVISIONING_FAILED} - broker RPC failure during provisioning</li>
 *   <li>{@code SUB_DECODE_FAILED} - codec failure, handled inside the delivery loop</li>
 *   <li>{@code SUB_RECEIVE_FAILED} - streaming session ended abnormally</li>
 * </ul>
 */
package com.subbridge.common.exception;
