// file: src/main/java/io/tabver/core/CrossDocumentException.java
package io.tabver.core;

public class CrossDocumentException extends TabVerException {
    public CrossDocumentException(String firstVersionId, String firstDocumentId,
                                  String secondVersionId, String secondDocumentId) {
        super("Versions belong to different documents: " + firstVersionId + " (" + firstDocumentId + ") vs "
                + secondVersionId + " (" + secondDocumentId + ")");
    }
}
