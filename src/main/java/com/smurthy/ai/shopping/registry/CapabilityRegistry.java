package com.smurthy.ai.shopping.registry;

import com.smurthy.ai.shopping.config.RegistryProperties;
import com.smurthy.ai.shopping.errors.HandlerUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Capability Registry
 *
 * Tracks which handlers exist, what they declare they can do, and how healthy they are.
 * Read-mostly: router lookups take the read lock, registration, heartbeats and the staleness
 * sweep take the write lock. Cards are immutable and replaced on every change.
 *
 * A card that has not heartbeated within the staleness window is flipped to
 * {@link HealthStatus#UNREACHABLE} by {@link #sweepStale()}.
 */
@Service
public class CapabilityRegistry {

    private static final Logger log = LoggerFactory.getLogger(CapabilityRegistry.class);

    private final Map<String, CapabilityCard> cards = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final RegistryProperties properties;
    private final HandlerProbe probe;
    private final Clock clock;

    public CapabilityRegistry(RegistryProperties properties, HandlerProbe probe, Clock clock) {
        this.properties = properties;
        this.probe = probe;
        this.clock = clock;
    }

    /**
     * Adds or replaces a card. A newly registered handler is {@link HealthStatus#UNKNOWN}
     * until its first heartbeat.
     */
    public CapabilityCard register(CapabilityCard card) {
        CapabilityCard stored = new CapabilityCard(card.name(), card.description(), card.capabilities(),
                HealthStatus.UNKNOWN, null);
        lock.writeLock().lock();
        try {
            cards.put(stored.name(), stored);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Registered handler {} with capabilities {}", stored.name(), stored.capabilities());
        return stored;
    }

    public boolean unregister(String name) {
        lock.writeLock().lock();
        try {
            boolean removed = cards.remove(name) != null;
            if (removed) {
                log.info("Unregistered handler {}", name);
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<CapabilityCard> list() {
        lock.readLock().lock();
        try {
            return sorted(cards.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<CapabilityCard> get(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(cards.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Records a heartbeat and marks the handler healthy.
     *
     * @throws HandlerUnavailableException if no handler with that name is registered
     */
    public CapabilityCard heartbeat(String name) {
        lock.writeLock().lock();
        try {
            CapabilityCard card = cards.get(name);
            if (card == null) {
                throw new HandlerUnavailableException(name);
            }
            CapabilityCard refreshed = card.withHeartbeat(clock.instant());
            cards.put(name, refreshed);
            if (card.status() != HealthStatus.HEALTHY) {
                log.info("Handler {} is now HEALTHY (was {})", name, card.status());
            }
            return refreshed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void markStatus(String name, HealthStatus status) {
        lock.writeLock().lock();
        try {
            CapabilityCard card = cards.get(name);
            if (card == null) {
                throw new HandlerUnavailableException(name);
            }
            if (card.status() != status) {
                cards.put(name, card.withStatus(status));
                log.warn("Handler {} marked {} (was {})", name, status, card.status());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Healthy handlers declaring {@code capability}, ordered by name.
     */
    public List<CapabilityCard> findCapable(String capability) {
        lock.readLock().lock();
        try {
            return sorted(cards.values().stream()
                    .filter(CapabilityCard::isHealthy)
                    .filter(c -> c.hasCapability(capability))
                    .toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Flips every healthy or degraded card whose last heartbeat is older than the staleness
     * window to UNREACHABLE.
     *
     * @return names of the handlers that were flipped
     */
    public List<String> sweepStale() {
        Instant cutoff = clock.instant().minus(properties.staleness());
        List<String> flipped = new ArrayList<>();
        lock.writeLock().lock();
        try {
            for (CapabilityCard card : List.copyOf(cards.values())) {
                boolean live = card.status() == HealthStatus.HEALTHY || card.status() == HealthStatus.DEGRADED;
                if (live && card.lastHeartbeat() != null && card.lastHeartbeat().isBefore(cutoff)) {
                    cards.put(card.name(), card.withStatus(HealthStatus.UNREACHABLE));
                    flipped.add(card.name());
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (!flipped.isEmpty()) {
            log.warn("No heartbeat within {} from {}; marked UNREACHABLE", properties.staleness(), flipped);
        }
        return flipped;
    }

    /**
     * Sends {@code message} to every healthy handler not in {@code excludeNames} and collects
     * each reply. A probe that throws yields a failed entry; it never aborts the broadcast.
     */
    public Map<String, BroadcastResult> broadcast(String message, Set<String> excludeNames) {
        Set<String> excluded = excludeNames == null ? Set.of() : excludeNames;
        List<CapabilityCard> targets = list().stream()
                .filter(CapabilityCard::isHealthy)
                .filter(c -> !excluded.contains(c.name()))
                .toList();
        log.debug("Broadcasting to {} handlers (excluded {})", targets.size(), excluded);

        Map<String, BroadcastResult> results = new LinkedHashMap<>();
        for (CapabilityCard target : targets) {
            long start = System.currentTimeMillis();
            try {
                String reply = probe.probe(target.name(), message);
                results.put(target.name(), BroadcastResult.ok(target.name(), reply, System.currentTimeMillis() - start));
            } catch (RuntimeException e) {
                log.warn("Broadcast probe to {} failed: {}", target.name(), e.getMessage());
                results.put(target.name(), BroadcastResult.failed(target.name(), e.getMessage(),
                        System.currentTimeMillis() - start));
            }
        }
        return results;
    }

    public int healthyCount() {
        lock.readLock().lock();
        try {
            return (int) cards.values().stream().filter(CapabilityCard::isHealthy).count();
        } finally {
            lock.readLock().unlock();
        }
    }

    private static List<CapabilityCard> sorted(Collection<CapabilityCard> cards) {
        return cards.stream().sorted(Comparator.comparing(CapabilityCard::name)).toList();
    }
}
