// file: src/main/java/io/tabver/core/InvalidResolutionException.java
package io.tabver.core;

/** A manual resolution names a location that is not an unresolved conflict. */
public class InvalidResolutionException extends TabVerException {
    public InvalidResolutionException(String message) {
        super(message);
    }
}
