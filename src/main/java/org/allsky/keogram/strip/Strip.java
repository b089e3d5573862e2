package org.allsky.keogram.strip;

import org.allsky.keogram.image.PixelBuffer;

/**
 * A band of pixels cut from one image, already reprojected onto the field of
 * view and height of the keogram it is destined for.
 */
public class Strip {

    private final PixelBuffer pixels;

    Strip(PixelBuffer pixels) {
        this.pixels = pixels;
    }

    public PixelBuffer getPixels() {
        return pixels;
    }

    public int getWidth() {
        return pixels.getWidth();
    }

    public int getHeight() {
        return pixels.getHeight();
    }

    /**
     * Average the strip across its width.
     *
     * @return A one column buffer holding the column-wise mean of the strip
     */
    public PixelBuffer columnMean() {
        int width = pixels.getWidth();
        PixelBuffer mean = new PixelBuffer(pixels.getMode(), 1, pixels.getHeight());
        for (int y = 0; y < pixels.getHeight(); y++) {
            for (int c = 0; c < pixels.getChannels(); c++) {
                long sum = 0;
                for (int x = 0; x < width; x++) {
                    sum += pixels.get(x, y, c);
                }
                mean.set(0, y, c, (int) (sum / width));
            }
        }
        return mean;
    }

    @Override
    public String toString() {
        return "Strip{" + "width=" + getWidth() + ", height=" + getHeight() + '}';
    }
}
