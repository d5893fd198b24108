// file: src/main/java/io/tabver/server/dto/CompareResponse.java
package io.tabver.server.dto;

import java.util.List;

public class CompareResponse {
    public List<DiffEntryJson> diffs;
    public SummaryJson summary;
}
