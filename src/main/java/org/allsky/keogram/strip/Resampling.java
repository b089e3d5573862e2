package org.allsky.keogram.strip;

import java.awt.geom.AffineTransform;
import org.allsky.keogram.image.PixelBuffer;

/**
 * Pixel level geometric operations used when cutting strips out of images.
 */
public class Resampling {

    // Guards against coordinates such as 2.9999999 landing in the wrong pixel after a rotation
    private static final double EPSILON = 1e-9;

    private Resampling() {
    }

    /**
     * Rotate a buffer anticlockwise about its centre. Nearest neighbour
     * sampling is used so that no new pixel values are created. Pixels which
     * rotate in from outside the buffer are set to background.
     *
     * @param source The buffer to rotate
     * @param degrees Anticlockwise rotation in degrees
     * @return The rotated buffer, or the source itself if no rotation is needed
     */
    public static PixelBuffer rotate(PixelBuffer source, double degrees) {
        if (degrees % 360.0 == 0.0) {
            return source;
        }
        int width = source.getWidth();
        int height = source.getHeight();
        int channels = source.getChannels();
        // y runs downwards, so an anticlockwise rotation on screen is a negative angle here.
        // We need the inverse mapping (target to source), which is the positive angle.
        AffineTransform inverse = AffineTransform.getRotateInstance(Math.toRadians(degrees), width / 2.0, height / 2.0);
        PixelBuffer result = new PixelBuffer(source.getMode(), width, height);
        double[] point = new double[2];
        for (int x = 0; x < width; x++) {
            for (int y = 0; y < height; y++) {
                point[0] = x + 0.5;
                point[1] = y + 0.5;
                inverse.transform(point, 0, point, 0, 1);
                int sx = (int) Math.floor(point[0] + EPSILON);
                int sy = (int) Math.floor(point[1] + EPSILON);
                if (sx < 0 || sy < 0 || sx >= width || sy >= height) {
                    continue;
                }
                for (int c = 0; c < channels; c++) {
                    result.set(x, y, c, source.get(sx, sy, c));
                }
            }
        }
        return result;
    }

    /**
     * Resize a buffer in the row direction, leaving the number of columns
     * unchanged. The first and last rows of the source map exactly onto the
     * first and last rows of the result.
     *
     * @param source The buffer to resize
     * @param rows The new number of rows
     * @param nearest If true nearest neighbour sampling is used, otherwise
     * linear interpolation between neighbouring rows
     * @return The resized buffer
     */
    public static PixelBuffer resizeRows(PixelBuffer source, int rows, boolean nearest) {
        int sourceRows = source.getHeight();
        if (sourceRows == rows) {
            return source;
        }
        PixelBuffer result = new PixelBuffer(source.getMode(), source.getWidth(), rows);
        double scale = rows == 1 ? 0 : (sourceRows - 1) / (double) (rows - 1);
        for (int y = 0; y < rows; y++) {
            double sy = y * scale;
            int y0 = Math.min((int) Math.floor(sy), sourceRows - 1);
            int y1 = Math.min(y0 + 1, sourceRows - 1);
            double frac = sy - y0;
            for (int x = 0; x < source.getWidth(); x++) {
                for (int c = 0; c < source.getChannels(); c++) {
                    int value;
                    if (nearest) {
                        value = source.get(x, frac < 0.5 ? y0 : y1, c);
                    } else {
                        int v0 = source.get(x, y0, c);
                        int v1 = source.get(x, y1, c);
                        value = (int) Math.round(v0 + (v1 - (double) v0) * frac);
                    }
                    result.set(x, y, c, value);
                }
            }
        }
        return result;
    }
}
