// file: src/main/java/io/tabver/storage/VersionStore.java
package io.tabver.storage;

import io.tabver.core.NormalizedTable;
import io.tabver.core.Version;

import java.util.Optional;

/**
 * Versioned storage of tabular documents.
 * <p>
 * Contract:
 *  - versions are immutable once created and never deleted,
 *  - within a document, content hashes are unique and version numbers run
 *    1, 2, 3, ... in creation order without gaps,
 *  - a version becomes visible to readers only after it is durable, together
 *    with all of its cells.
 */
public interface VersionStore {

    /**
     * Create a new version of a document.
     *
     * @param parentVersionId existing version of the same document, or null. When null and the
     *                        document already has versions, the latest one becomes the parent.
     * @param tag             optional label, may be null
     * @throws io.tabver.core.DuplicateVersionException if identical content already exists for the document
     * @throws io.tabver.core.InvalidParentException    if the parent is unknown or belongs to another document
     */
    Version createVersion(String documentId, String parentVersionId, NormalizedTable table, String actor, String tag);

    default Version createVersion(String documentId, String parentVersionId, NormalizedTable table, String actor) {
        return createVersion(documentId, parentVersionId, table, actor, null);
    }

    /**
     * @throws io.tabver.core.VersionNotFoundException if no such version exists
     */
    StoredVersion getVersion(String versionId);

    Optional<Version> findVersion(String versionId);

    /**
     * Page through a document's versions.
     *
     * @param afterVersionNumber exclusive lower bound, null to start at the beginning
     * @param limit              page size, see {@link VersionPage#clampLimit(Integer)}
     */
    VersionPage listVersions(String documentId, Integer afterVersionNumber, Integer limit);

    Optional<Version> findByHash(String documentId, String contentHash);

    /** Latest version of a document, if any. */
    Optional<Version> latest(String documentId);
}
