// file: src/main/java/io/tabver/core/VersionNotFoundException.java
package io.tabver.core;

public class VersionNotFoundException extends TabVerException {
    private final String versionId;

    public VersionNotFoundException(String versionId) {
        super("Version not found: " + versionId);
        this.versionId = versionId;
    }

    public String versionId() {
        return versionId;
    }
}
