// file: src/main/java/io/tabver/server/dto/ConflictJson.java
package io.tabver.server.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One contested location. Absent values (cell missing on that side) are null.
 * resolution is one of auto | unresolved | manual; resolvedValue, winner and
 * choice are filled when they apply.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConflictJson {
    public String sheet;
    public int row;
    public int column;
    public String ref;
    public String kind;          // value | formula | type_mismatch | removed_vs_modified
    public ValueJson baseValue;
    public ValueJson leftValue;
    public ValueJson rightValue;
    public String resolution;
    public ValueJson resolvedValue;
    public double confidence;
    public String winner;        // left | right, auto only
    public String choice;        // left | right | base | value, manual only
    public String reason;
}
