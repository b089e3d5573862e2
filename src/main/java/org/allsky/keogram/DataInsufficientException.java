package org.allsky.keogram;

/**
 * Thrown when there are too few images to do what was asked, for example to
 * estimate the data spacing automatically.
 */
public class DataInsufficientException extends KeogramException {

    public DataInsufficientException(String message) {
        super(message);
    }
}
