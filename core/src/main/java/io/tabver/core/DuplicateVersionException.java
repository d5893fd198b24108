// file: src/main/java/io/tabver/core/DuplicateVersionException.java
package io.tabver.core;

/**
 * The document already has a version with identical content. Carries the id of
 * that version so callers can treat the upload as "no changes".
 */
public class DuplicateVersionException extends TabVerException {
    private final String existingVersionId;

    public DuplicateVersionException(String documentId, String existingVersionId) {
        super("Document " + documentId + " already has identical content in version " + existingVersionId);
        this.existingVersionId = existingVersionId;
    }

    public String existingVersionId() {
        return existingVersionId;
    }
}
