package org.allsky.keogram.interp;

import org.allsky.keogram.image.PixelBuffer;

/**
 * Walks consecutive pairs of data points and hands each bridgeable gap to
 * {@link #fill}.
 */
abstract class GapInterpolator implements Interpolator {

    @Override
    public void interpolate(PixelBuffer buffer, int[] dataPoints, int stripWidth, int maxGap) {
        int halfStrip = stripWidth / 2;
        for (int i = 1; i < dataPoints.length; i++) {
            int a = dataPoints[i - 1];
            int b = dataPoints[i];
            int gap = b - a;
            if (gap <= stripWidth || gap > maxGap) {
                continue;
            }
            int left = a + halfStrip;
            int right = b - halfStrip;
            if (left < 0 || right >= buffer.getWidth() || right - left < 2) {
                continue;
            }
            fill(buffer, left, right);
        }
    }

    /**
     * Fill the columns strictly between <code>left</code> and
     * <code>right</code> using those two columns as end points.
     */
    abstract void fill(PixelBuffer buffer, int left, int right);
}
