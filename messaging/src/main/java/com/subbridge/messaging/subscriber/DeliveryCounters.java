/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.subbridge.messaging.subscriber;

import java.util.concurrent.atomic.LongAdder;

/** Message counters shared by every delivery loop of one subscriber. */
final class DeliveryCounters {

    final LongAdder received = new LongAdder();
    final LongAdder delivered = new LongAdder();
    final LongAdder acked = new LongAdder();
    final LongAdder nacked = new LongAdder();
    final LongAdder decodeFailures = new LongAdder();

    SubscriberStats snapshot(int activeLoops, int subscriptions) {
        return new SubscriberStats(received.sum(), delivered.sum(), acked.sum(), nacked.sum(),
                decodeFailures.sum(), activeLoops, subscriptions);
    }
}
