// file: src/main/java/io/tabver/server/dto/SheetJson.java
package io.tabver.server.dto;

import java.util.List;

public class SheetJson {
    public String name;
    public List<CellJson> cells;
}
