package org.allsky.keogram.interp;

import org.allsky.keogram.image.PixelBuffer;

/**
 * Linear interpolation of every channel, row by row. Values are truncated
 * towards zero.
 */
public class LinearInterpolator extends GapInterpolator {

    @Override
    void fill(PixelBuffer buffer, int left, int right) {
        int span = right - left;
        for (int y = 0; y < buffer.getHeight(); y++) {
            for (int c = 0; c < buffer.getChannels(); c++) {
                long start = buffer.get(left, y, c);
                long end = buffer.get(right, y, c);
                double gradient = (double) (end - start) / span;
                for (int x = left + 1; x < right; x++) {
                    buffer.set(x, y, c, (int) (start + gradient * (x - left)));
                }
            }
        }
    }
}
