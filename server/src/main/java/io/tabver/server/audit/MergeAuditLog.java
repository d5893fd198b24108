// file: src/main/java/io/tabver/server/audit/MergeAuditLog.java
package io.tabver.server.audit;

import io.tabver.server.merge.MergeRequest;
import io.tabver.server.merge.MergeResult;

/**
 * Append-only record of merge outcomes, blocked merges included.
 * <p>
 * Implementations must be safe for concurrent callers and must not return before
 * the entry is written.
 */
public interface MergeAuditLog {

    void append(MergeRequest request, String documentId, MergeResult result);
}
