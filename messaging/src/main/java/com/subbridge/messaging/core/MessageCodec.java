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

import com.subbridge.common.exception.DecodeFailedException;

/**
 * Converts between broker-native messages and domain {@link Message}s.
 * Implementations must be thread-safe; a single instance serves every delivery loop.
 */
public interface MessageCodec {

    /**
     * @throws DecodeFailedException if the raw message cannot be turned into a domain message
     */
    Message decode(RawMessage raw);

    EncodedMessage encode(Message message);
}
