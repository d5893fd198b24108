// file: src/main/java/io/tabver/storage/VersionPage.java
package io.tabver.storage;

import io.tabver.core.Version;

import java.util.List;

/**
 * One page of a document's version history, ascending by version number.
 *
 * @param nextCursor version number to pass as "after" for the next page; null on the last page
 */
public record VersionPage(List<Version> versions, Integer nextCursor) {
    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 100;

    public VersionPage {
        versions = List.copyOf(versions);
    }

    public static VersionPage empty() {
        return new VersionPage(List.of(), null);
    }

    /** Default 50, clamped to [1, 100]. */
    public static int clampLimit(Integer limit) {
        if (limit == null) return DEFAULT_LIMIT;
        return Math.max(1, Math.min(MAX_LIMIT, limit));
    }
}
