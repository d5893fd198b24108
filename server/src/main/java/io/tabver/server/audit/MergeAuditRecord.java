// file: src/main/java/io/tabver/server/audit/MergeAuditRecord.java
package io.tabver.server.audit;

import io.tabver.server.dto.ConflictJson;
import io.tabver.server.dto.JsonMapping;
import io.tabver.server.merge.MergeRequest;
import io.tabver.server.merge.MergeResult;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * One line of the merge audit log.
 * Example (wrapped):
 *   {"at":"2026-01-05T10:15:30Z","documentId":"plate-7","actor":"carol",
 *    "baseVersionId":"...","leftVersionId":"...","rightVersionId":"...",
 *    "mergedVersionId":null,"outcome":"blocked","allowPartial":false,
 *    "autoResolvedCount":3,"manuallyResolvedCount":0,"unresolvedCount":1,
 *    "confidenceScore":0.75,"conflicts":[...]}
 */
public class MergeAuditRecord {
    public String at;
    public String documentId;
    public String actor;
    public String baseVersionId;
    public String leftVersionId;
    public String rightVersionId;
    public String mergedVersionId;
    public String outcome;
    public boolean allowPartial;
    public int autoResolvedCount;
    public int manuallyResolvedCount;
    public int unresolvedCount;
    public double confidenceScore;
    public List<ConflictJson> conflicts;

    public static MergeAuditRecord of(Instant at, MergeRequest request, String documentId, MergeResult result) {
        MergeAuditRecord r = new MergeAuditRecord();
        r.at = at.toString();
        r.documentId = documentId;
        r.actor = request.actor();
        r.baseVersionId = result.baseVersionId();
        r.leftVersionId = result.leftVersionId();
        r.rightVersionId = result.rightVersionId();
        r.mergedVersionId = result.mergedVersionId();
        r.outcome = result.outcome().name().toLowerCase(Locale.ROOT);
        r.allowPartial = request.allowPartial();
        r.autoResolvedCount = result.autoResolvedCount();
        r.manuallyResolvedCount = result.manuallyResolvedCount();
        r.unresolvedCount = result.unresolvedCount();
        r.confidenceScore = result.confidenceScore();
        r.conflicts = result.conflicts().stream().map(JsonMapping::fromConflict).toList();
        return r;
    }
}
