package com.leanfinance.services.onboardings.client;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory cache whose entries expire a fixed time after being stored.
 * No background refresh: an expired entry is dropped on the next read.
 */
public final class TtlCache<K, V> {

    private final ConcurrentHashMap<K, Entry<V>> map = new ConcurrentHashMap<>();
    private final Clock clock;
    private final long ttlMillis;

    public TtlCache(Clock clock, long ttlSeconds) {
        this.clock = clock;
        this.ttlMillis = Math.max(0, ttlSeconds) * 1000L;
    }

    public Optional<V> get(K key) {
        Entry<V> entry = map.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.expiresAtMs() <= clock.millis()) {
            map.remove(key, entry);
            return Optional.empty();
        }
        return Optional.ofNullable(entry.value());
    }

    public void put(K key, V value) {
        map.put(key, new Entry<>(value, clock.millis() + ttlMillis));
    }

    public void invalidate() {
        map.clear();
    }

    public int size() {
        return map.size();
    }

    private record Entry<V>(V value, long expiresAtMs) {
    }
}
