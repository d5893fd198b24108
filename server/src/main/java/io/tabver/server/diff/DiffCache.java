// file: src/main/java/io/tabver/server/diff/DiffCache.java
package io.tabver.server.diff;

import io.tabver.core.diff.DiffOptions;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bounded LRU cache of diff reports keyed by (from, to, options).
 * <p>
 * Versions never change, so an entry never goes stale; eviction is purely
 * about memory. A capacity of 0 disables caching.
 */
public final class DiffCache {
    public static final int DEFAULT_CAPACITY = 256;

    record Key(String fromVersionId, String toVersionId, DiffOptions options) {}

    private final int capacity;
    private final LinkedHashMap<Key, DiffReport> entries;
    private long hits;
    private long misses;

    public DiffCache() {
        this(DEFAULT_CAPACITY);
    }

    public DiffCache(int capacity) {
        if (capacity < 0) throw new IllegalArgumentException("capacity must be >= 0");
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Key, DiffReport> eldest) {
                return size() > DiffCache.this.capacity;
            }
        };
    }

    public synchronized DiffReport get(String fromId, String toId, DiffOptions options) {
        DiffReport r = entries.get(new Key(fromId, toId, options));
        if (r == null) misses++;
        else hits++;
        return r;
    }

    public synchronized void put(String fromId, String toId, DiffOptions options, DiffReport report) {
        if (capacity == 0) return;
        entries.put(new Key(fromId, toId, options), report);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized long hits() {
        return hits;
    }

    public synchronized long misses() {
        return misses;
    }
}
