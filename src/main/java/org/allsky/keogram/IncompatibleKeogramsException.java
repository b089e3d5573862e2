package org.allsky.keogram;

/**
 *
 */
public class IncompatibleKeogramsException extends CompatibilityException {

    public IncompatibleKeogramsException(String message) {
        super("Cannot combine keograms with different " + message);
    }
}
