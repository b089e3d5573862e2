package org.allsky.keogram.interp;

import org.allsky.keogram.cmap.ColourTable;
import org.allsky.keogram.image.Mode;
import org.allsky.keogram.image.PixelBuffer;

/**
 * Fills the gaps between strips of a keogram.
 */
public interface Interpolator {

    /**
     * Fill the columns between consecutive data points, in place. Gaps
     * narrower than a strip are already covered, gaps wider than
     * <code>maxGap</code> are real outages and are left as background.
     *
     * @param buffer The keogram pixels
     * @param dataPoints Sorted, unique pixel columns holding real data
     * @param stripWidth Width of the strip placed at each data point
     * @param maxGap Widest gap, in pixels, that is bridged
     */
    void interpolate(PixelBuffer buffer, int[] dataPoints, int stripWidth, int maxGap);

    /**
     * Choose the interpolator suitable for a keogram.
     *
     * @param mode The keogram mode
     * @param colourTable The keogram colour table, or null
     * @return The interpolator
     */
    static Interpolator forKeogram(Mode mode, ColourTable colourTable) {
        if (mode == Mode.RGB && colourTable != null) {
            return new ColourTableInterpolator(colourTable);
        }
        return new LinearInterpolator();
    }
}
