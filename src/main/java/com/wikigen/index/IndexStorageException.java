package com.wikigen.index;

import java.io.IOException;

/**
 * Raised when the catalog database cannot be read or written. Never swallowed:
 * a half-applied write would leave the catalog and its full-text projection apart.
 */
public class IndexStorageException extends IOException {
    public IndexStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
