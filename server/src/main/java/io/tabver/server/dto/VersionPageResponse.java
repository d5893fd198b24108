// file: src/main/java/io/tabver/server/dto/VersionPageResponse.java
package io.tabver.server.dto;

import java.util.List;

/** Response for GET /documents/{documentId}/versions. nextCursor is null on the last page. */
public class VersionPageResponse {
    public List<VersionJson> versions;
    public Integer nextCursor;
}
