// file: src/main/java/io/tabver/server/merge/MergeRequest.java
package io.tabver.server.merge;

import io.tabver.core.CellKey;
import io.tabver.core.merge.ManualResolution;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Input of a three-way merge.
 *
 * @param allowPartial create a merged version even when conflicts stay unresolved
 *                     (left's value is kept at those locations)
 * @param resolutions  human decisions for unresolved conflicts, may be empty
 */
public record MergeRequest(
        String baseVersionId,
        String leftVersionId,
        String rightVersionId,
        String actor,
        boolean allowPartial,
        Map<CellKey, ManualResolution> resolutions
) {
    public MergeRequest {
        requireText(baseVersionId, "baseVersionId");
        requireText(leftVersionId, "leftVersionId");
        requireText(rightVersionId, "rightVersionId");
        requireText(actor, "actor");
        resolutions = resolutions == null
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(resolutions));
    }

    public static MergeRequest of(String base, String left, String right, String actor) {
        return new MergeRequest(base, left, right, actor, false, Map.of());
    }

    public MergeRequest withAllowPartial(boolean v) {
        return new MergeRequest(baseVersionId, leftVersionId, rightVersionId, actor, v, resolutions);
    }

    public MergeRequest withResolutions(Map<CellKey, ManualResolution> r) {
        return new MergeRequest(baseVersionId, leftVersionId, rightVersionId, actor, allowPartial, r);
    }

    private static void requireText(String s, String name) {
        Objects.requireNonNull(s, name);
        if (s.isBlank()) throw new IllegalArgumentException(name + " must not be blank");
    }
}
