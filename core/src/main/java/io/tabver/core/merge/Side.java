// file: src/main/java/io/tabver/core/merge/Side.java
package io.tabver.core.merge;

/** Branch of a three-way merge. LEFT is the primary lineage (parent of the merged version). */
public enum Side {
    LEFT,
    RIGHT;

    public Side other() {
        return this == LEFT ? RIGHT : LEFT;
    }
}
