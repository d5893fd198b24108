// file: src/main/java/io/tabver/server/dto/VersionJson.java
package io.tabver.server.dto;

/** Version metadata; createdAt is ISO-8601. */
public class VersionJson {
    public String id;
    public String documentId;
    public int versionNumber;
    public String parentVersionId;
    public String contentHash;
    public String createdAt;
    public String createdBy;
    public String tag;
    public int cellCount;
}
