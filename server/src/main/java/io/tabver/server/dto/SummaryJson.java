// file: src/main/java/io/tabver/server/dto/SummaryJson.java
package io.tabver.server.dto;

public class SummaryJson {
    public int added;
    public int removed;
    public int modified;
    public int unchanged;
    public int rowsInserted;
    public int rowsDeleted;
    public int total;
}
