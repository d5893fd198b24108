// file: src/test/java/io/tabver/server/audit/JsonlMergeAuditLogTest.java
package io.tabver.server.audit;

import io.tabver.core.CellKey;
import io.tabver.core.CellValue;
import io.tabver.core.merge.Conflict;
import io.tabver.core.merge.ConflictKind;
import io.tabver.core.merge.Resolution;
import io.tabver.server.merge.MergeRequest;
import io.tabver.server.merge.MergeResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonlMergeAuditLogTest {

    @TempDir Path dir;

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-03T04:05:06Z"), ZoneOffset.UTC);

    private static MergeResult blocked() {
        Conflict c = new Conflict(CellKey.of("Sheet1", 0, 0),
                CellValue.number(10), CellValue.number(20), CellValue.number(99),
                ConflictKind.VALUE, new Resolution.Unresolved(0.2),
                "both sides changed to different numeric values (diverge by 790% of base), no dominant history");
        return new MergeResult(null, "base", "left", "right", MergeResult.Outcome.BLOCKED,
                0, 0, 1, List.of(c), 0.0, true);
    }

    private static MergeResult merged() {
        return new MergeResult("merged", "base", "left", "right", MergeResult.Outcome.MERGED,
                3, 0, 0, List.of(), 1.0, true);
    }

    @Test
    void each_outcome_becomes_one_json_line() throws Exception {
        Path file = dir.resolve("audit").resolve("merges.jsonl");
        try (var log = new JsonlMergeAuditLog(file, CLOCK)) {
            log.append(MergeRequest.of("base", "left", "right", "carol"), "doc", blocked());
            log.append(MergeRequest.of("base", "left", "right", "carol"), "doc", merged());
        }

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).startsWith("{"), lines.get(0));
        assertTrue(lines.get(0).contains("\"outcome\":\"blocked\""), lines.get(0));
    }

    @Test
    void records_read_back_with_their_conflicts() throws Exception {
        Path file = dir.resolve("merges.jsonl");
        try (var log = new JsonlMergeAuditLog(file, CLOCK)) {
            log.append(MergeRequest.of("base", "left", "right", "carol"), "doc", blocked());

            List<MergeAuditRecord> records = log.readAll();
            assertEquals(1, records.size());
            MergeAuditRecord r = records.get(0);
            assertEquals("2026-02-03T04:05:06Z", r.at);
            assertEquals("doc", r.documentId);
            assertEquals("carol", r.actor);
            assertNull(r.mergedVersionId);
            assertEquals("blocked", r.outcome);
            assertEquals(1, r.unresolvedCount);
            assertEquals(1, r.conflicts.size());
            assertEquals("Sheet1!A1", r.conflicts.get(0).ref);
            assertEquals("unresolved", r.conflicts.get(0).resolution);
            assertEquals("number", r.conflicts.get(0).rightValue.type);
            assertEquals(99.0, ((Number) r.conflicts.get(0).rightValue.value).doubleValue());
        }
    }

    @Test
    void reopening_appends_instead_of_truncating() throws Exception {
        Path file = dir.resolve("merges.jsonl");
        try (var log = new JsonlMergeAuditLog(file, CLOCK)) {
            log.append(MergeRequest.of("base", "left", "right", "carol"), "doc", merged());
        }
        try (var log = new JsonlMergeAuditLog(file, CLOCK)) {
            log.append(MergeRequest.of("base", "left", "right", "dave"), "doc", merged());
            List<MergeAuditRecord> records = log.readAll();
            assertEquals(2, records.size());
            assertEquals("carol", records.get(0).actor);
            assertEquals("dave", records.get(1).actor);
        }
    }
}
