package com.rcasentinel.core.io;

import java.io.IOException;

/**
 * Thrown when a snapshot document is not valid JSON or does not have the
 * expected top-level structure.
 *
 * @since 1.0.0
 */
public class SnapshotFormatException extends IOException {

    private static final long serialVersionUID = 1L;

    public SnapshotFormatException(String message) {
        super(message);
    }

    public SnapshotFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
