// file: src/main/java/io/tabver/server/dto/DiffEntryJson.java
package io.tabver.server.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/** One diff entry. Row-level entries have column -1 and no values. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DiffEntryJson {
    public String sheet;
    public int row;
    public int column;
    public String ref;          // A1-style reference, e.g. Sheet1!B3
    public String kind;         // added | removed | modified | unchanged | row_inserted | row_deleted
    public ValueJson oldValue;
    public ValueJson newValue;
    public Integer originRow;   // structural mode, paired row that moved
}
