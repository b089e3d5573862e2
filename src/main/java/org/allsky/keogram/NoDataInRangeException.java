package org.allsky.keogram;

/**
 *
 */
public class NoDataInRangeException extends RangeException {

    public NoDataInRangeException(String message) {
        super(message);
    }
}
