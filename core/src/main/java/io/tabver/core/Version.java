// file: src/main/java/io/tabver/core/Version.java
package io.tabver.core;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable metadata of one version of a document.
 * <p>
 * The cell content lives next to it in the store; a Version never changes after
 * creation and is never deleted.
 *
 * @param parentVersionId null only for the first version of a document
 * @param tag             optional free-form label, at most {@link #MAX_TAG_LENGTH} chars
 */
public record Version(
        String id,
        String documentId,
        int versionNumber,
        String parentVersionId,
        String contentHash,
        Instant createdAt,
        String createdBy,
        String tag,
        int cellCount
) {
    public static final int MAX_TAG_LENGTH = 50;

    public Version {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(contentHash, "contentHash");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(createdBy, "createdBy");
        if (versionNumber < 1) throw new IllegalArgumentException("versionNumber must be >= 1");
        if (cellCount < 0) throw new IllegalArgumentException("cellCount must be >= 0");
        if (tag != null && tag.length() > MAX_TAG_LENGTH) {
            throw new IllegalArgumentException("tag longer than " + MAX_TAG_LENGTH + " characters");
        }
    }

    public Optional<String> parent() {
        return Optional.ofNullable(parentVersionId);
    }
}
