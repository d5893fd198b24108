// file: src/main/java/io/tabver/core/Value.java
package io.tabver.core;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Typed cell payload.
 * <p>
 * Equality is typed: {@code Numeric(10)} and {@code Text("10")} are different
 * values. Numbers are normalized on construction so that {@code -0.0} equals
 * {@code 0.0}; NaN equals NaN (record equality goes through
 * {@link Double#compare}).
 */
public sealed interface Value permits Value.Text, Value.Numeric, Value.Bool, Value.Empty, Value.Formula {

    Type type();

    /** Numeric view of this value, looking through a formula's cached result. */
    default OptionalDouble asNumber() {
        return OptionalDouble.empty();
    }

    enum Type {
        TEXT(1), NUMBER(2), BOOLEAN(3), EMPTY(4), FORMULA(5);

        private final int tag;

        Type(int tag) { this.tag = tag; }

        /** Stable on-disk / fingerprint tag. */
        public int tag() { return tag; }

        public static Type fromTag(int tag) {
            for (Type t : values()) {
                if (t.tag == tag) return t;
            }
            throw new IllegalArgumentException("Unknown value type tag: " + tag);
        }
    }

    record Text(String text) implements Value {
        public Text {
            Objects.requireNonNull(text, "text");
        }
        @Override public Type type() { return Type.TEXT; }
    }

    record Numeric(double number) implements Value {
        public Numeric {
            if (number == 0.0d) number = 0.0d; // folds -0.0
        }
        @Override public Type type() { return Type.NUMBER; }
        @Override public OptionalDouble asNumber() { return OptionalDouble.of(number); }
    }

    record Bool(boolean bool) implements Value {
        @Override public Type type() { return Type.BOOLEAN; }
    }

    record Empty() implements Value {
        public static final Empty INSTANCE = new Empty();
        @Override public Type type() { return Type.EMPTY; }
    }

    /**
     * A formula with its last computed result. The cached result is never itself
     * a formula.
     */
    record Formula(String expression, Value cached) implements Value {
        public Formula {
            Objects.requireNonNull(expression, "expression");
            Objects.requireNonNull(cached, "cached");
            if (cached instanceof Formula) {
                throw new IllegalArgumentException("cached value of a formula cannot be a formula");
            }
        }
        @Override public Type type() { return Type.FORMULA; }
        @Override public OptionalDouble asNumber() { return cached.asNumber(); }
    }
}
