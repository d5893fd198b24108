// file: src/main/java/io/tabver/server/dto/CreateVersionRequest.java
package io.tabver.server.dto;

/**
 * JSON body for POST /versions.
 * Example:
 *   {
 *     "documentId": "plate-layout-7",
 *     "parentVersionId": null,
 *     "actor": "alice",
 *     "tag": "v2-final",
 *     "table": { "sheets": [ ... ] }
 *   }
 */
public class CreateVersionRequest {
    public String documentId;
    public String parentVersionId; // optional, defaults to the latest version
    public String actor;
    public String tag;             // optional
    public TableJson table;
}
