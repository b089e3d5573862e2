package org.allsky.keogram;

import java.time.Instant;
import java.util.List;

/**
 * Intensity along the time axis of a keogram, at a fixed angle.
 */
public class HorizontalSlice extends IntensityProfile<Instant> {

    private final double angle;

    HorizontalSlice(double angle, List<Instant> times, double[] intensities, Double calibrationFactor) {
        super(times, intensities, calibrationFactor);
        this.angle = angle;
    }

    public double getAngle() {
        return angle;
    }

    public List<Instant> getTimes() {
        return getPositions();
    }

    @Override
    public String toString() {
        return "HorizontalSlice{" + "angle=" + angle + ", size=" + size() + '}';
    }
}
