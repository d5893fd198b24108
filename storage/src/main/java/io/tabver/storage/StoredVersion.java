// file: src/main/java/io/tabver/storage/StoredVersion.java
package io.tabver.storage;

import io.tabver.core.NormalizedTable;
import io.tabver.core.Version;

import java.util.Objects;

/** A version together with its full cell set. */
public record StoredVersion(Version version, NormalizedTable table) {
    public StoredVersion {
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(table, "table");
    }

    public String id() {
        return version.id();
    }
}
