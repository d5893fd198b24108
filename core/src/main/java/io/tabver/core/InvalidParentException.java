// file: src/main/java/io/tabver/core/InvalidParentException.java
package io.tabver.core;

/** Parent id is unknown or belongs to another document. */
public class InvalidParentException extends TabVerException {
    public InvalidParentException(String documentId, String parentVersionId) {
        super("Parent version " + parentVersionId + " is not a version of document " + documentId);
    }
}
