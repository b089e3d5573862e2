package org.allsky.keogram.interp;

import org.allsky.keogram.image.PixelBuffer;

/**
 * Leaves the buffer untouched. Used for partial keograms which are
 * interpolated once after they have been merged.
 */
public class NullInterpolator implements Interpolator {

    @Override
    public void interpolate(PixelBuffer buffer, int[] dataPoints, int stripWidth, int maxGap) {
    }

    @Override
    public boolean equals(Object obj) {
        return obj != null && this.getClass().equals(obj.getClass());
    }

    @Override
    public int hashCode() {
        return NullInterpolator.class.hashCode();
    }
}
