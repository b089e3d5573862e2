package org.allsky.keogram;

/**
 *
 */
public class IncompatibleImagesException extends CompatibilityException {

    public IncompatibleImagesException(String message) {
        super(message);
    }
}
