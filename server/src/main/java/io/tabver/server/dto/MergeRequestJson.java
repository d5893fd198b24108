// file: src/main/java/io/tabver/server/dto/MergeRequestJson.java
package io.tabver.server.dto;

import java.util.List;

/**
 * JSON body for POST /diff/merge.
 * Example:
 *   {
 *     "baseVersionId": "...", "leftVersionId": "...", "rightVersionId": "...",
 *     "actor": "carol", "allowPartial": false,
 *     "resolutions": [ { "sheet": "Sheet1", "row": 0, "column": 0, "choice": "left" } ]
 *   }
 */
public class MergeRequestJson {
    public String baseVersionId;
    public String leftVersionId;
    public String rightVersionId;
    public String actor;
    public Boolean allowPartial;            // optional, default false
    public List<ResolutionJson> resolutions; // optional
}
