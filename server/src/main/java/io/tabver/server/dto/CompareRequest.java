// file: src/main/java/io/tabver/server/dto/CompareRequest.java
package io.tabver.server.dto;

/**
 * JSON body for POST /diff/compare.
 * Example:
 *   { "fromVersionId": "...", "toVersionId": "...", "options": { "structuralAware": true } }
 */
public class CompareRequest {
    public String fromVersionId;
    public String toVersionId;
    public DiffOptionsJson options; // optional
}
