// file: src/main/java/io/tabver/core/StorageException.java
package io.tabver.core;

/** I/O failure in a persistence layer. The original cause is always preserved. */
public class StorageException extends TabVerException {
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
