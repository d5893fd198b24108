// file: src/main/java/io/tabver/core/TabVerException.java
package io.tabver.core;

/**
 * Base type of every domain error. Unchecked: callers that can recover (for example
 * from a duplicate upload) catch the specific subtype.
 */
public class TabVerException extends RuntimeException {
    public TabVerException(String message) {
        super(message);
    }

    public TabVerException(String message, Throwable cause) {
        super(message, cause);
    }
}
