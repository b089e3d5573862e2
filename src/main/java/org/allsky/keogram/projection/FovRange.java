package org.allsky.keogram.projection;

import org.allsky.keogram.ConfigurationException;

/**
 * A range of angles, in degrees, across the sky. 0 and 180 degrees are the
 * horizons and 90 degrees the zenith.
 */
public final class FovRange {

    public static final FovRange FULL_SKY = new FovRange(0, 180);

    private final double min;
    private final double max;

    public FovRange(double min, double max) {
        if (!(min < max)) {
            throw new ConfigurationException("Lower field of view angle bound must be smaller than upper bound: (" + min + ", " + max + ")");
        }
        if (min < 0.0 || max > 180.0) {
            throw new ConfigurationException("Field of view bounds must be in the range 0.0 - 180.0 degrees: (" + min + ", " + max + ")");
        }
        this.min = min;
        this.max = max;
    }

    /**
     * The range covered by an image whose field of view extends
     * <code>fovAngle</code> degrees either side of the zenith.
     *
     * @param fovAngle Half angle of the image field of view
     * @return The range
     */
    public static FovRange aroundZenith(double fovAngle) {
        return new FovRange(90.0 - fovAngle, 90.0 + fovAngle);
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double getSpan() {
        return max - min;
    }

    public boolean contains(double angle) {
        return angle >= min && angle <= max;
    }

    public boolean contains(FovRange other) {
        return other.min >= min && other.max <= max;
    }

    @Override
    public String toString() {
        return "(" + min + ", " + max + ")";
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 37 * hash + Double.hashCode(this.min);
        hash = 37 * hash + Double.hashCode(this.max);
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
        final FovRange other = (FovRange) obj;
        return Double.compare(this.min, other.min) == 0 && Double.compare(this.max, other.max) == 0;
    }
}
