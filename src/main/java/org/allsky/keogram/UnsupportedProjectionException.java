package org.allsky.keogram;

/**
 * Thrown when a lens projection name is not one of the supported models.
 */
public class UnsupportedProjectionException extends ConfigurationException {

    public UnsupportedProjectionException(String projection) {
        super("Unknown lens projection \"" + projection + "\", expecting \"equidistant\" or \"equisolidangle\"");
    }
}
