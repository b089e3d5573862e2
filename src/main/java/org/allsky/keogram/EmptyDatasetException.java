package org.allsky.keogram;

/**
 *
 */
public class EmptyDatasetException extends DataInsufficientException {

    public EmptyDatasetException() {
        super("Cannot create a keogram from an empty dataset");
    }
}
