package org.allsky.keogram.image;

import java.util.Arrays;
import java.util.Objects;
import org.allsky.keogram.ConfigurationException;

/**
 * A width x height x channels block of pixels. Values are held as ints
 * regardless of mode, the mode decides the legal range of each value. Pixel
 * (0,0) is the top left corner, x runs along the width (time in a keogram)
 * and y along the height (angle in a keogram).
 */
public class PixelBuffer {

    private final Mode mode;
    private final int width;
    private final int height;
    private final int channels;
    private final int[] data;

    public PixelBuffer(Mode mode, int width, int height) {
        this(mode, width, height, new int[checkSize(width, height, mode.getChannels())]);
    }

    public PixelBuffer(Mode mode, int width, int height, int[] data) {
        checkSize(width, height, mode.getChannels());
        this.mode = mode;
        this.width = width;
        this.height = height;
        this.channels = mode.getChannels();
        if (data.length != width * height * channels) {
            throw new IllegalArgumentException("Data length " + data.length + " does not match " + width + "x" + height + "x" + channels);
        }
        this.data = data;
    }

    private static int checkSize(int width, int height, int channels) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Illegal buffer size " + width + "x" + height);
        }
        try {
            return Math.multiplyExact(Math.multiplyExact(width, height), channels);
        } catch (ArithmeticException x) {
            throw new ConfigurationException("Buffer of " + width + "x" + height + "x" + channels + " pixels is too large");
        }
    }

    private int index(int x, int y, int c) {
        return (x * height + y) * channels + c;
    }

    public int get(int x, int y, int c) {
        return data[index(x, y, c)];
    }

    public void set(int x, int y, int c, int value) {
        data[index(x, y, c)] = mode.clamp(value);
    }

    /**
     * Returns the pixel as a packed 0xRRGGBB value. Only meaningful for RGB
     * buffers.
     *
     * @param x The column
     * @param y The row
     * @return The packed colour
     */
    public int getRGB(int x, int y) {
        int i = index(x, y, 0);
        return data[i] << 16 | data[i + 1] << 8 | data[i + 2];
    }

    public void setRGB(int x, int y, int rgb) {
        int i = index(x, y, 0);
        data[i] = (rgb >> 16) & 0xff;
        data[i + 1] = (rgb >> 8) & 0xff;
        data[i + 2] = rgb & 0xff;
    }

    public boolean isBackground(int x, int y) {
        int i = index(x, y, 0);
        for (int c = 0; c < channels; c++) {
            if (data[i + c] != 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Copy whole columns from another buffer of the same height and mode.
     * Columns which fall outside either buffer are skipped.
     *
     * @param source The buffer to copy from
     * @param sourceX The first source column
     * @param targetX The first target column
     * @param count The number of columns
     */
    public void copyColumns(PixelBuffer source, int sourceX, int targetX, int count) {
        if (source.height != height || source.mode != mode) {
            throw new IllegalArgumentException("Incompatible buffers");
        }
        int columnLength = height * channels;
        for (int i = 0; i < count; i++) {
            int sx = sourceX + i;
            int tx = targetX + i;
            if (sx < 0 || sx >= source.width || tx < 0 || tx >= width) {
                continue;
            }
            System.arraycopy(source.data, sx * columnLength, data, tx * columnLength, columnLength);
        }
    }

    /**
     * Returns a new buffer holding the given rectangle of this one.
     *
     * @param x The first column
     * @param y The first row
     * @param w The number of columns
     * @param h The number of rows
     * @return The cropped copy
     */
    public PixelBuffer crop(int x, int y, int w, int h) {
        if (x < 0 || y < 0 || x + w > width || y + h > height) {
            throw new IllegalArgumentException(String.format("Crop [%d,%d %dx%d] outside of %dx%d buffer", x, y, w, h, width, height));
        }
        PixelBuffer result = new PixelBuffer(mode, w, h);
        for (int i = 0; i < w; i++) {
            System.arraycopy(data, index(x + i, y, 0), result.data, result.index(i, 0, 0), h * channels);
        }
        return result;
    }

    public PixelBuffer copy() {
        return new PixelBuffer(mode, width, height, data.clone());
    }

    public Mode getMode() {
        return mode;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getChannels() {
        return channels;
    }

    /**
     * Returns a copy of the raw data, laid out column by column with the
     * channels of each pixel adjacent.
     *
     * @return The data
     */
    public int[] getData() {
        return data.clone();
    }

    @Override
    public String toString() {
        return "PixelBuffer{" + "mode=" + mode + ", width=" + width + ", height=" + height + '}';
    }

    @Override
    public int hashCode() {
        int hash = 3;
        hash = 41 * hash + Objects.hashCode(this.mode);
        hash = 41 * hash + this.width;
        hash = 41 * hash + this.height;
        hash = 41 * hash + Arrays.hashCode(this.data);
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final PixelBuffer other = (PixelBuffer) obj;
        return this.width == other.width && this.height == other.height
                && this.mode == other.mode && Arrays.equals(this.data, other.data);
    }
}
