// file: src/main/java/io/tabver/server/dto/ValueJson.java
package io.tabver.server.dto;

/**
 * JSON form of a typed cell value.
 * Examples:
 *   { "type": "number", "value": 10, "raw": "10" }
 *   { "type": "formula", "formula": "SUM(A1:A3)", "value": 6, "cachedType": "number" }
 *   { "type": "empty" }
 */
public class ValueJson {
    public String type;        // text | number | boolean | empty | formula
    public Object value;       // payload, or the cached payload of a formula
    public String raw;         // original string form, derived from value when absent
    public String formula;     // expression, formula cells only
    public String cachedType;  // type of the cached value, formula cells only
}
