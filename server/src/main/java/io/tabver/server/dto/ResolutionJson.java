// file: src/main/java/io/tabver/server/dto/ResolutionJson.java
package io.tabver.server.dto;

/**
 * Manual resolution of one conflict.
 * Examples:
 *   { "sheet": "Sheet1", "row": 0, "column": 0, "choice": "right" }
 *   { "sheet": "Sheet1", "row": 0, "column": 0, "choice": "value", "value": { "type": "number", "value": 42 } }
 */
public class ResolutionJson {
    public String sheet;
    public int row;
    public int column;
    public String choice;    // left | right | base | value
    public ValueJson value;  // only with choice "value"
}
