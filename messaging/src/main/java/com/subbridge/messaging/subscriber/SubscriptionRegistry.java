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

import com.subbridge.messaging.gateway.SubscriptionHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Caches one {@link SubscriptionHandle} per derived subscription name.
 *
 * <p>Lookups take the read lock; a miss takes the write lock, checks again, and provisions
 * while holding it, so concurrent callers for the same name trigger a single provisioning
 * attempt. Failed attempts are not cached.
 */
public class SubscriptionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final SubscriptionNameFunction nameFunction;
    private final SubscriptionProvisioner provisioner;
    private final Map<String, SubscriptionHandle> handles = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public SubscriptionRegistry(SubscriptionNameFunction nameFunction, SubscriptionProvisioner provisioner) {
        this.nameFunction = nameFunction;
        this.provisioner = provisioner;
    }

    public String subscriptionName(String topic) {
        return nameFunction.apply(topic);
    }

    public SubscriptionHandle resolve(String topic) {
        String name = subscriptionName(topic);

        lock.readLock().lock();
        try {
            SubscriptionHandle cached = handles.get(name);
            if (cached != null) return cached;
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            SubscriptionHandle cached = handles.get(name);
            if (cached != null) return cached;

            SubscriptionHandle handle = provisioner.provision(name, topic);
            handles.put(name, handle);
            log.debug("Cached subscription '{}' for topic '{}'", name, topic);
            return handle;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<String> subscriptionNames() {
        lock.readLock().lock();
        try {
            return List.copyOf(new ArrayList<>(handles.keySet()));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return handles.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
