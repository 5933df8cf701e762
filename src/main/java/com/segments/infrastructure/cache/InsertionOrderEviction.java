package com.segments.infrastructure.cache;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Evicts the oldest inserted key. Reads do not refresh an entry.
 */
public class InsertionOrderEviction<K> implements EvictionPolicy<K> {

    private final Deque<K> order = new ArrayDeque<>();

    @Override
    public void onInsert(K key) {
        order.addLast(key);
    }

    @Override
    public void onAccess(K key) {
        // insertion order only
    }

    @Override
    public void onRemove(K key) {
        order.remove(key);
    }

    @Override
    public K victim() {
        return order.peekFirst();
    }

    @Override
    public void clear() {
        order.clear();
    }
}
