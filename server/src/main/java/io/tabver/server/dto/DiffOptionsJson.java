// file: src/main/java/io/tabver/server/dto/DiffOptionsJson.java
package io.tabver.server.dto;

/** Comparison options; absent fields take their defaults (false / 0). */
public class DiffOptionsJson {
    public Boolean ignoreWhitespace;
    public Boolean ignoreCase;
    public Boolean structuralAware;
    public Boolean includeUnchanged;
    public Double numericEpsilon;
}
