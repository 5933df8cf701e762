package com.segments.infrastructure.cache;

import java.util.Iterator;
import java.util.LinkedHashSet;

/**
 * Evicts the key that was read or written longest ago.
 */
public class LeastRecentlyUsedEviction<K> implements EvictionPolicy<K> {

    private final LinkedHashSet<K> order = new LinkedHashSet<>();

    @Override
    public void onInsert(K key) {
        touch(key);
    }

    @Override
    public void onAccess(K key) {
        touch(key);
    }

    @Override
    public void onRemove(K key) {
        order.remove(key);
    }

    @Override
    public K victim() {
        Iterator<K> it = order.iterator();
        return it.hasNext() ? it.next() : null;
    }

    @Override
    public void clear() {
        order.clear();
    }

    private void touch(K key) {
        order.remove(key);
        order.add(key);
    }
}
