// file: src/main/java/io/tabver/server/dto/MergeResponse.java
package io.tabver.server.dto;

import java.util.List;

/** Response for POST /diff/merge. mergedVersionId is null when the merge was blocked. */
public class MergeResponse {
    public String mergedVersionId;
    public String baseVersionId;
    public String leftVersionId;
    public String rightVersionId;
    public String outcome;       // merged | partial | blocked | unchanged
    public int autoResolvedCount;
    public int manuallyResolvedCount;
    public int unresolvedCount;
    public List<ConflictJson> conflicts;
    public double confidenceScore;
    public boolean audited;      // false when the audit log write failed
}
