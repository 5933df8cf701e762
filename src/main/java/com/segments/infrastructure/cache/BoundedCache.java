package com.segments.infrastructure.cache;

import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Small fixed-capacity read-through cache.
 *
 * Loading happens outside the lock: two threads missing on the same key may both
 * compute it, and the first insert wins. Loaders must therefore be idempotent.
 * A loader that throws leaves the cache unchanged.
 */
@Slf4j
public class BoundedCache<K, V> {

    private final String name;
    private final int capacity;
    private final EvictionPolicy<K> evictionPolicy;
    private final Map<K, V> entries = new HashMap<>();

    public BoundedCache(String name, int capacity, EvictionPolicy<K> evictionPolicy) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Cache capacity must be positive: " + capacity);
        }
        this.name = name;
        this.capacity = capacity;
        this.evictionPolicy = evictionPolicy;
    }

    public synchronized Optional<V> get(K key) {
        V value = entries.get(key);
        if (value != null) {
            evictionPolicy.onAccess(key);
        }
        return Optional.ofNullable(value);
    }

    /**
     * Return the cached value, computing and inserting it on a miss.
     */
    public V getOrCompute(K key, Function<? super K, ? extends V> loader) {
        Optional<V> cached = get(key);
        if (cached.isPresent()) {
            return cached.get();
        }

        V computed = loader.apply(key);
        if (computed == null) {
            throw new IllegalStateException("Cache loader returned null for key " + key);
        }
        return putIfAbsent(key, computed);
    }

    private synchronized V putIfAbsent(K key, V value) {
        V existing = entries.get(key);
        if (existing != null) {
            evictionPolicy.onAccess(key);
            return existing;
        }

        while (entries.size() >= capacity) {
            K victim = evictionPolicy.victim();
            if (victim == null) {
                break;
            }
            entries.remove(victim);
            evictionPolicy.onRemove(victim);
            log.debug("Cache {} evicted {}", name, victim);
        }

        entries.put(key, value);
        evictionPolicy.onInsert(key);
        return value;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
        evictionPolicy.clear();
    }
}
