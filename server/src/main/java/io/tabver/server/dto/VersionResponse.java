// file: src/main/java/io/tabver/server/dto/VersionResponse.java
package io.tabver.server.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Response for POST /versions (version only) and GET /versions/{id} (version and table).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VersionResponse {
    public VersionJson version;
    public TableJson table;
}
