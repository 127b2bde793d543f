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

import com.subbridge.common.exception.ProvisioningFailedException;
import com.subbridge.common.exception.SubscriptionMissingException;
import com.subbridge.common.exception.TopicMissingException;
import com.subbridge.messaging.gateway.BrokerGateway;
import com.subbridge.messaging.gateway.SubscriptionHandle;
import com.subbridge.messaging.gateway.TopicRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Makes sure a subscription (and, if needed, its topic) exists on the broker.
 *
 * <p>Each call is a single attempt; nothing is retried. Creation of missing resources is
 * governed by {@link SubscriberConfig#isDoNotCreateSubscriptionIfMissing()} and
 * {@link SubscriberConfig#isDoNotCreateTopicIfMissing()}.
 */
public class SubscriptionProvisioner {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionProvisioner.class);

    private final BrokerGateway gateway;
    private final SubscriberConfig config;

    public SubscriptionProvisioner(BrokerGateway gateway, SubscriberConfig config) {
        this.gateway = gateway;
        this.config = config;
    }

    /**
     * Resolve or create subscription {@code name} attached to {@code topic}.
     *
     * @throws SubscriptionMissingException if absent and creation is disabled
     * @throws TopicMissingException if the topic is absent and its creation is disabled
     * @throws ProvisioningFailedException if any broker call fails
     */
    public SubscriptionHandle provision(String name, String topic) {
        boolean subscriptionExists;
        try {
            subscriptionExists = gateway.subscriptionExists(name);
        } catch (RuntimeException e) {
            throw new ProvisioningFailedException("could not check if subscription " + name + " exists", e);
        }
        if (subscriptionExists) {
            log.debug("Subscription '{}' already exists", name);
            return gateway.subscriptionRef(name);
        }
        if (config.isDoNotCreateSubscriptionIfMissing()) {
            throw new SubscriptionMissingException(name);
        }

        TopicRef topicRef = ensureTopic(name, topic);

        try {
            SubscriptionHandle handle = gateway.createSubscription(name, topicRef, config.getSubscriptionOptions());
            log.info("Created subscription '{}' for topic '{}'", name, topic);
            return handle;
        } catch (RuntimeException e) {
            throw new ProvisioningFailedException("could not create subscription " + name, e);
        }
    }

    private TopicRef ensureTopic(String subscription, String topic) {
        boolean topicExists;
        try {
            topicExists = gateway.topicExists(topic);
        } catch (RuntimeException e) {
            throw new ProvisioningFailedException("could not check if topic " + topic + " exists", e);
        }
        if (topicExists) {
            return gateway.topicRef(topic);
        }
        if (config.isDoNotCreateTopicIfMissing()) {
            throw new TopicMissingException(topic);
        }
        try {
            TopicRef created = gateway.createTopic(topic);
            log.info("Created topic '{}'", topic);
            return created;
        } catch (RuntimeException e) {
            throw new ProvisioningFailedException(
                    "could not create topic " + topic + " for subscription " + subscription, e);
        }
    }
}
