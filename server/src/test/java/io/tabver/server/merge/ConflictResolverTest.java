// file: src/test/java/io/tabver/server/merge/ConflictResolverTest.java
package io.tabver.server.merge;

import io.tabver.core.CellValue;
import io.tabver.core.CrossDocumentException;
import io.tabver.core.Version;
import io.tabver.core.merge.Conflict;
import io.tabver.core.merge.Decision;
import io.tabver.core.merge.Resolution;
import io.tabver.core.merge.ResolverSettings;
import io.tabver.core.merge.Side;
import io.tabver.server.diff.DiffEngine;
import io.tabver.storage.DurableVersionStore;
import io.tabver.storage.InMemoryPreferenceWeightStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;

import static io.tabver.server.TestTables.at;
import static io.tabver.server.TestTables.cells;
import static io.tabver.server.TestTables.openStore;
import static org.junit.jupiter.api.Assertions.*;

class ConflictResolverTest {

    @TempDir Path dataDir;

    private DurableVersionStore store;
    private InMemoryPreferenceWeightStore weights;
    private ConflictResolver resolver;

    @BeforeEach
    void open() {
        store = openStore(dataDir);
        weights = new InMemoryPreferenceWeightStore();
        resolver = new ConflictResolver(store, new DiffEngine(store), weights, ResolverSettings.defaults());
    }

    @AfterEach
    void close() {
        store.close();
    }

    @Test
    void edits_to_different_cells_are_applied_from_their_side() {
        Version base = store.createVersion("doc", null, cells("A1", 10, "B1", 1), "alice");
        Version left = store.createVersion("doc", base.id(), cells("A1", 11, "B1", 1), "alice");
        Version right = store.createVersion("doc", base.id(), cells("A1", 10, "B1", 2), "bob");

        ResolutionPlan plan = resolver.resolve(base.id(), left.id(), right.id());

        assertEquals(2, plan.decisions().size());
        var a1 = assertInstanceOf(Decision.Apply.class, plan.decisions().get(0));
        assertEquals(at("A1"), a1.location());
        assertEquals(Decision.Source.LEFT, a1.source());
        var b1 = assertInstanceOf(Decision.Apply.class, plan.decisions().get(1));
        assertEquals(Decision.Source.RIGHT, b1.source());
        assertEquals(CellValue.number(2), b1.value());
        assertTrue(plan.conflicts().isEmpty());
    }

    @Test
    void diverging_numbers_without_history_stay_unresolved() {
        Version base = store.createVersion("doc", null, cells("A1", 10), "alice");
        Version left = store.createVersion("doc", base.id(), cells("A1", 20), "alice");
        Version right = store.createVersion("doc", base.id(), cells("A1", 99), "bob");

        ResolutionPlan plan = resolver.resolve(base.id(), left.id(), right.id());

        assertEquals(1, plan.conflicts().size());
        Conflict c = plan.conflicts().get(0);
        assertEquals(CellValue.number(10), c.baseValue());
        assertEquals(CellValue.number(20), c.leftValue());
        assertEquals(CellValue.number(99), c.rightValue());
        assertInstanceOf(Resolution.Unresolved.class, c.resolution());
        assertTrue(c.reason().contains("no dominant history"), c.reason());
    }

    @Test
    void persisted_history_can_lift_a_close_conflict_over_the_threshold() {
        Version base = store.createVersion("doc", null, cells("A1", 10), "alice");
        Version left = store.createVersion("doc", base.id(), cells("A1", 20), "alice");
        Version right = store.createVersion("doc", base.id(), cells("A1", 21), "bob");

        // without history: 0.2 (type) + 0.3 * 0.9 (closeness) = 0.47
        Conflict before = resolver.resolve(base.id(), left.id(), right.id()).conflicts().get(0);
        assertFalse(before.isResolved());

        Instant t = Instant.parse("2026-01-01T00:00:00Z");
        for (int i = 0; i < 10; i++) {
            weights.recordOutcome("doc", "alice", true, t);
            weights.recordOutcome("doc", "bob", false, t);
        }

        // alice 11/12, bob 1/12: + 0.5 * 0.833 -> 0.887
        Conflict after = resolver.resolve(base.id(), left.id(), right.id()).conflicts().get(0);
        var auto = assertInstanceOf(Resolution.AutoResolved.class, after.resolution());
        assertEquals(Side.LEFT, auto.winner());
        assertEquals(CellValue.number(20), auto.value());
        assertEquals(0.887, auto.confidence(), 1e-3);
        assertEquals(CellValue.number(21), after.rightValue(), "rejected value is kept");
    }

    @Test
    void history_of_another_document_does_not_count() {
        Version base = store.createVersion("doc", null, cells("A1", 10), "alice");
        Version left = store.createVersion("doc", base.id(), cells("A1", 20), "alice");
        Version right = store.createVersion("doc", base.id(), cells("A1", 21), "bob");

        Instant t = Instant.parse("2026-01-01T00:00:00Z");
        for (int i = 0; i < 10; i++) {
            weights.recordOutcome("other-doc", "alice", true, t);
            weights.recordOutcome("other-doc", "bob", false, t);
        }

        assertFalse(resolver.resolve(base.id(), left.id(), right.id()).conflicts().get(0).isResolved());
    }

    @Test
    void resolving_does_not_touch_preference_weights() {
        Version base = store.createVersion("doc", null, cells("A1", 10), "alice");
        Version left = store.createVersion("doc", base.id(), cells("A1", 20), "alice");
        Version right = store.createVersion("doc", base.id(), cells("A1", 99), "bob");

        resolver.resolve(base.id(), left.id(), right.id());

        assertEquals(0, weights.get("doc", "alice").revision());
        assertEquals(0, weights.get("doc", "bob").revision());
    }

    @Test
    void versions_must_share_a_document() {
        Version base = store.createVersion("doc", null, cells("A1", 10), "alice");
        Version left = store.createVersion("doc", base.id(), cells("A1", 20), "alice");
        Version foreign = store.createVersion("other", null, cells("A1", 99), "bob");

        assertThrows(CrossDocumentException.class, () -> resolver.resolve(base.id(), left.id(), foreign.id()));
    }
}
