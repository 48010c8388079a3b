package com.shardmesh.materializer;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per key, held only while some thread uses it. Entries are dropped when the last holder leaves.
 */
class KeyedLocks<K> {
    private final Map<K, Entry> locks = new ConcurrentHashMap<>();

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private int holders;
    }

    <T> T withLock(K key, Supplier<T> action) {
        Entry entry = locks.compute(key, (k, existing) -> {
            Entry e = existing == null ? new Entry() : existing;
            e.holders++;
            return e;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(key, (k, e) -> --e.holders == 0 ? null : e);
        }
    }

    int activeKeys() {
        return locks.size();
    }
}
