package org.allsky.keogram.image;

/**
 * Pixel mode of an image or keogram. The names follow the usual image library
 * conventions: L is 8 bit greyscale, I is 32 bit signed intensity and RGB is
 * three 8 bit colour channels.
 */
public enum Mode {

    L(1, 0, 255),
    I(1, Integer.MIN_VALUE, Integer.MAX_VALUE),
    RGB(3, 0, 255);

    private final int channels;
    private final int minValue;
    private final int maxValue;

    Mode(int channels, int minValue, int maxValue) {
        this.channels = channels;
        this.minValue = minValue;
        this.maxValue = maxValue;
    }

    public int getChannels() {
        return channels;
    }

    public boolean isEightBit() {
        return maxValue == 255;
    }

    /**
     * Clamp a value into the range representable by this mode.
     *
     * @param value The value to clamp
     * @return The clamped value
     */
    public int clamp(long value) {
        if (value < minValue) {
            return minValue;
        } else if (value > maxValue) {
            return maxValue;
        } else {
            return (int) value;
        }
    }

    public static Mode forName(String name) {
        for (Mode mode : values()) {
            if (mode.name().equals(name)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported mode: " + name);
    }
}
