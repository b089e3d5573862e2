package org.allsky.keogram;

/**
 * Thrown for invalid build parameters, for example a non-positive strip width
 * or a malformed field of view range.
 */
public class ConfigurationException extends KeogramException {

    public ConfigurationException(String message) {
        super(message);
    }
}
