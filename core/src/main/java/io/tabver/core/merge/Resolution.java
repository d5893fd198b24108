// file: src/main/java/io/tabver/core/merge/Resolution.java
package io.tabver.core.merge;

import io.tabver.core.CellValue;

import java.util.Objects;

/**
 * How a conflict was settled:
 *  - AutoResolved: the confidence cleared the threshold; value is the winning side's.
 *  - Unresolved: needs a human; confidence is what the heuristic reached.
 *  - Manual: a human picked the value. A null value means the cell is removed.
 */
public sealed interface Resolution permits Resolution.AutoResolved, Resolution.Unresolved, Resolution.Manual {

    double confidence();

    record AutoResolved(CellValue value, double confidence, Side winner) implements Resolution {
        public AutoResolved {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(winner, "winner");
        }
    }

    record Unresolved(double confidence) implements Resolution {}

    record Manual(CellValue value, ManualResolution.Choice choice) implements Resolution {
        public Manual {
            Objects.requireNonNull(choice, "choice");
        }

        @Override
        public double confidence() {
            return 1.0;
        }
    }
}
