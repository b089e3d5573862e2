package org.allsky.keogram;

/**
 * Thrown when images or keograms cannot be mixed because their mode, colour
 * table, lens projection or calibration differ.
 */
public class CompatibilityException extends KeogramException {

    public CompatibilityException(String message) {
        super(message);
    }
}
