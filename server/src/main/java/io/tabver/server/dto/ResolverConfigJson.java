// file: src/main/java/io/tabver/server/dto/ResolverConfigJson.java
package io.tabver.server.dto;

/**
 * Optional JSON file passed with --resolver-config. Absent fields keep their
 * defaults; command-line flags win over the file.
 * Example:
 *   { "autoResolveThreshold": 0.9, "typeWeight": 0.2, "numericWeight": 0.3, "historyWeight": 0.5 }
 */
public class ResolverConfigJson {
    public Double autoResolveThreshold;
    public Double typeWeight;
    public Double numericWeight;
    public Double historyWeight;
    public Integer minHistory;
    public Double numericEpsilon;
}
