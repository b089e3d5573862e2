package org.allsky.keogram;

/**
 * Base class of all errors raised while building or transforming a keogram.
 */
public class KeogramException extends RuntimeException {

    public KeogramException(String message) {
        super(message);
    }

    public KeogramException(String message, Throwable cause) {
        super(message, cause);
    }
}
