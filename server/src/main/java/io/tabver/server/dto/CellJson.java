// file: src/main/java/io/tabver/server/dto/CellJson.java
package io.tabver.server.dto;

/** One cell of a sheet: zero-based position plus its value. */
public class CellJson extends ValueJson {
    public int row;
    public int column;
}
