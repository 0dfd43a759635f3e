package me.golemcore.proxy.adapter.inbound.daemon;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.proxy.adapter.inbound.stdio.StdioRelay;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Relays hosted by the daemon, keyed by server id. Lookups share the read
 * lock; registration and removal take the write lock.
 */
@Slf4j
public class DaemonRegistry {

    private final Map<String, StdioRelay> relays = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public void register(String serverId, StdioRelay relay) {
        lock.writeLock().lock();
        try {
            if (relays.containsKey(serverId)) {
                throw new IllegalStateException("server id already registered: " + serverId);
            }
            relays.put(serverId, relay);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<StdioRelay> remove(String serverId) {
        lock.writeLock().lock();
        try {
            return Optional.ofNullable(relays.remove(serverId));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<StdioRelay> get(String serverId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(relays.get(serverId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return relays.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> serverIds() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(relays.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Removes every relay and stops them outside the lock, so their exit
     * watchers can still reach the registry.
     */
    public void stopAll() {
        List<StdioRelay> snapshot;
        lock.writeLock().lock();
        try {
            snapshot = new ArrayList<>(relays.values());
            relays.clear();
        } finally {
            lock.writeLock().unlock();
        }
        for (StdioRelay relay : snapshot) {
            log.info("[Daemon] Stopping relay {}", relay.getServerId());
            relay.stop();
        }
    }
}
