package org.allsky.keogram;

/**
 * Thrown when a requested time or angle window does not overlap the available
 * data, or exceeds the bounds of a keogram.
 */
public class RangeException extends KeogramException {

    public RangeException(String message) {
        super(message);
    }
}
