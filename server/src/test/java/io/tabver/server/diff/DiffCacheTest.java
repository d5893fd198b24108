// file: src/test/java/io/tabver/server/diff/DiffCacheTest.java
package io.tabver.server.diff;

import io.tabver.core.diff.DiffOptions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiffCacheTest {
    private static final DiffOptions OPTS = DiffOptions.defaults();
    private static final DiffReport EMPTY = DiffReport.of(List.of());

    @Test
    void least_recently_used_entry_is_evicted_first() {
        DiffCache cache = new DiffCache(2);
        cache.put("a", "b", OPTS, EMPTY);
        cache.put("b", "c", OPTS, EMPTY);
        assertNotNull(cache.get("a", "b", OPTS)); // a->b is now the most recent

        cache.put("c", "d", OPTS, EMPTY);

        assertEquals(2, cache.size());
        assertNotNull(cache.get("a", "b", OPTS));
        assertNull(cache.get("b", "c", OPTS));
        assertNotNull(cache.get("c", "d", OPTS));
    }

    @Test
    void direction_matters() {
        DiffCache cache = new DiffCache(4);
        cache.put("a", "b", OPTS, EMPTY);

        assertNull(cache.get("b", "a", OPTS));
    }

    @Test
    void zero_capacity_caches_nothing() {
        DiffCache cache = new DiffCache(0);
        cache.put("a", "b", OPTS, EMPTY);

        assertEquals(0, cache.size());
        assertNull(cache.get("a", "b", OPTS));
    }

    @Test
    void negative_capacity_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new DiffCache(-1));
    }
}
