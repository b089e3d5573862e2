package org.allsky.keogram.image;

/**
 * A decoded all-sky image together with its metadata.
 */
public class AllskyImage {

    private final PixelBuffer pixels;
    private final ImageInfo info;

    public AllskyImage(PixelBuffer pixels, ImageInfo info) {
        if (pixels.getMode() != info.getMode()) {
            throw new IllegalArgumentException("Pixel mode " + pixels.getMode() + " does not match image mode " + info.getMode());
        }
        this.pixels = pixels;
        this.info = info;
    }

    public PixelBuffer getPixels() {
        return pixels;
    }

    public ImageInfo getInfo() {
        return info;
    }

    public int getWidth() {
        return pixels.getWidth();
    }

    public int getHeight() {
        return pixels.getHeight();
    }

    @Override
    public String toString() {
        return "AllskyImage{" + "info=" + info + '}';
    }
}
