package com.segments.infrastructure.cache;

/**
 * Decides which key a full {@link BoundedCache} gives up.
 *
 * Implementations are only ever called while the owning cache holds its lock,
 * so they need no synchronization of their own.
 */
public interface EvictionPolicy<K> {

    void onInsert(K key);

    void onAccess(K key);

    void onRemove(K key);

    /**
     * Key to evict next, or null when nothing is tracked.
     */
    K victim();

    void clear();
}
