// file: src/main/java/io/tabver/core/merge/ManualResolution.java
package io.tabver.core.merge;

import io.tabver.core.CellValue;

import java.util.Objects;

/**
 * A human decision for one unresolved conflict: take left, right or base, or
 * write an explicit value.
 *
 * @param value only for {@link Choice#VALUE}, null otherwise
 */
public record ManualResolution(Choice choice, CellValue value) {

    public enum Choice { LEFT, RIGHT, BASE, VALUE }

    public ManualResolution {
        Objects.requireNonNull(choice, "choice");
        if (choice == Choice.VALUE && value == null) {
            throw new IllegalArgumentException("an explicit resolution needs a value");
        }
        if (choice != Choice.VALUE && value != null) {
            throw new IllegalArgumentException(choice + " resolution takes no value");
        }
    }

    public static ManualResolution left() {
        return new ManualResolution(Choice.LEFT, null);
    }

    public static ManualResolution right() {
        return new ManualResolution(Choice.RIGHT, null);
    }

    public static ManualResolution base() {
        return new ManualResolution(Choice.BASE, null);
    }

    public static ManualResolution value(CellValue value) {
        return new ManualResolution(Choice.VALUE, value);
    }

    /** The value this resolution writes for the conflict; null means the cell is removed. */
    public CellValue apply(Conflict conflict) {
        return switch (choice) {
            case LEFT -> conflict.leftValue();
            case RIGHT -> conflict.rightValue();
            case BASE -> conflict.baseValue();
            case VALUE -> value;
        };
    }

    /** Side whose value was chosen, or null for BASE / VALUE. */
    public Side chosenSide() {
        return switch (choice) {
            case LEFT -> Side.LEFT;
            case RIGHT -> Side.RIGHT;
            default -> null;
        };
    }
}
