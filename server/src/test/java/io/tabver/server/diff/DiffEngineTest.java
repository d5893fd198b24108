// file: src/test/java/io/tabver/server/diff/DiffEngineTest.java
package io.tabver.server.diff;

import io.tabver.core.CellValue;
import io.tabver.core.CrossDocumentException;
import io.tabver.core.Version;
import io.tabver.core.VersionNotFoundException;
import io.tabver.core.diff.DiffKind;
import io.tabver.core.diff.DiffOptions;
import io.tabver.storage.DurableVersionStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static io.tabver.server.TestTables.at;
import static io.tabver.server.TestTables.cells;
import static io.tabver.server.TestTables.openStore;
import static org.junit.jupiter.api.Assertions.*;

class DiffEngineTest {

    @TempDir Path dataDir;

    private DurableVersionStore store;
    private DiffCache cache;
    private DiffEngine engine;

    @BeforeEach
    void open() {
        store = openStore(dataDir);
        cache = new DiffCache(8);
        engine = new DiffEngine(store, cache);
    }

    @AfterEach
    void close() {
        store.close();
    }

    @Test
    void compare_reports_entries_in_location_order_with_a_summary() {
        Version v1 = store.createVersion("doc", null, cells("A1", 10, "B1", "x", "A2", 1), "alice");
        Version v2 = store.createVersion("doc", v1.id(), cells("A1", 11, "A2", 1, "C3", "new"), "bob");

        DiffReport report = engine.compare(v1.id(), v2.id(), DiffOptions.defaults());

        assertEquals(3, report.entries().size());
        assertEquals(at("A1"), report.entries().get(0).location());
        assertEquals(DiffKind.MODIFIED, report.entries().get(0).kind());
        assertEquals(CellValue.number(10), report.entries().get(0).oldValue());
        assertEquals(CellValue.number(11), report.entries().get(0).newValue());
        assertEquals(at("B1"), report.entries().get(1).location());
        assertEquals(DiffKind.REMOVED, report.entries().get(1).kind());
        assertEquals(at("C3"), report.entries().get(2).location());
        assertEquals(DiffKind.ADDED, report.entries().get(2).kind());

        assertEquals(1, report.summary().added());
        assertEquals(1, report.summary().removed());
        assertEquals(1, report.summary().modified());
        assertEquals(3, report.summary().total());
        assertEquals(v1.id(), report.entries().get(0).fromVersionId());
        assertEquals(v2.id(), report.entries().get(0).toVersionId());
    }

    @Test
    void comparing_a_version_with_itself_is_empty() {
        Version v1 = store.createVersion("doc", null, cells("A1", 10), "alice");

        DiffReport report = engine.compare(v1.id(), v1.id());

        assertTrue(report.entries().isEmpty());
        assertTrue(report.summary().noChanges());
    }

    @Test
    void unknown_version_is_not_found() {
        Version v1 = store.createVersion("doc", null, cells("A1", 10), "alice");

        var ex = assertThrows(VersionNotFoundException.class, () -> engine.compare(v1.id(), "nope", DiffOptions.defaults()));
        assertTrue(ex.getMessage().contains("nope"));
    }

    @Test
    void versions_of_different_documents_cannot_be_compared() {
        Version a = store.createVersion("doc-a", null, cells("A1", 10), "alice");
        Version b = store.createVersion("doc-b", null, cells("A1", 11), "alice");

        assertThrows(CrossDocumentException.class, () -> engine.compare(a.id(), b.id(), DiffOptions.defaults()));
    }

    @Test
    void repeated_comparisons_are_served_from_the_cache() {
        Version v1 = store.createVersion("doc", null, cells("A1", 10), "alice");
        Version v2 = store.createVersion("doc", v1.id(), cells("A1", 20), "alice");

        DiffReport first = engine.compare(v1.id(), v2.id(), DiffOptions.defaults());
        DiffReport second = engine.compare(v1.id(), v2.id(), DiffOptions.defaults());

        assertSame(first, second);
        assertEquals(1, cache.hits());
        assertEquals(1, cache.misses());
    }

    @Test
    void options_are_part_of_the_cache_key() {
        Version v1 = store.createVersion("doc", null, cells("A1", "Hello"), "alice");
        Version v2 = store.createVersion("doc", v1.id(), cells("A1", "hello"), "alice");

        assertEquals(1, engine.compare(v1.id(), v2.id(), DiffOptions.defaults()).entries().size());
        assertTrue(engine.compare(v1.id(), v2.id(), DiffOptions.defaults().withIgnoreCase(true)).entries().isEmpty());
        assertEquals(2, cache.size());
    }

    @Test
    void structural_option_reports_inserted_rows() {
        Version v1 = store.createVersion("doc", null, cells("A1", "id", "A2", "s1", "A3", "s2"), "alice");
        Version v2 = store.createVersion("doc", v1.id(), cells("A1", "id", "A2", "s0", "A3", "s1", "A4", "s2"), "alice");

        DiffReport report = engine.compare(v1.id(), v2.id(), DiffOptions.defaults().withStructuralAware(true));

        assertEquals(1, report.entries().size());
        assertEquals(DiffKind.ROW_INSERTED, report.entries().get(0).kind());
        assertEquals(1, report.entries().get(0).location().row());
        assertEquals(1, report.summary().rowsInserted());
    }
}
