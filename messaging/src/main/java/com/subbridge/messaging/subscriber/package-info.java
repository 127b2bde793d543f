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
 * Subscriber core: turns broker subscriptions into {@link com.subbridge.messaging.core.DeliveryChannel}s.
 *
 * <h3>Components</h3>
 * <ul>
 *   <li>{@link com.subbridge.messaging.subscriber.PubSubSubscriber} - facade, one per process</li>
 *   <li>{@link com.subbridge.messaging.subscriber.SubscriptionRegistry} - name to handle cache</li>
 *   <li>{@link com.subbridge.messaging.subscriber.SubscriptionProvisioner} - creates missing topics and subscriptions</li>
 *   <li>{@link com.subbridge.messaging.subscriber.DeliveryLoop} - one per active subscription</li>
 *   <li>{@link com.subbridge.messaging.subscriber.ShutdownCoordinator} - cancellation and drain on close</li>
 * </ul>
 *
 * <h3>Ack contract</h3>
 * Every message taken from a channel must be acked or nacked by the consumer. A message still
 * unsettled when the subscriber closes is nacked and will be redelivered.
 */
package com.subbridge.messaging.subscriber;
