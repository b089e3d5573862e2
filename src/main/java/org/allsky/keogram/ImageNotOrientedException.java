package org.allsky.keogram;

/**
 * Thrown when an image reaches the strip extractor without having been
 * masked, centred and aligned with north.
 */
public class ImageNotOrientedException extends KeogramException {

    public ImageNotOrientedException(String message) {
        super(message);
    }
}
