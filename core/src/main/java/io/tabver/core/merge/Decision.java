// file: src/main/java/io/tabver/core/merge/Decision.java
package io.tabver.core.merge;

import io.tabver.core.CellKey;
import io.tabver.core.CellValue;

import java.util.Objects;

/**
 * Outcome for one touched location of a three-way merge.
 *  - Apply: the change is taken as-is (one side only, or both sides agree).
 *    A null value means the cell is removed.
 *  - Contested: both sides changed the location differently; see the conflict's resolution.
 */
public sealed interface Decision permits Decision.Apply, Decision.Contested {

    CellKey location();

    enum Source { LEFT, RIGHT, BOTH }

    record Apply(CellKey location, CellValue value, Source source) implements Decision {
        public Apply {
            Objects.requireNonNull(location, "location");
            Objects.requireNonNull(source, "source");
        }

        public boolean isRemoval() {
            return value == null;
        }
    }

    record Contested(Conflict conflict) implements Decision {
        public Contested {
            Objects.requireNonNull(conflict, "conflict");
        }

        @Override
        public CellKey location() {
            return conflict.location();
        }
    }
}
