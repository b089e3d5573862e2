package org.allsky.keogram;

import java.time.Instant;
import java.util.List;

/**
 * Intensity along the angle axis of a keogram, at a fixed time.
 */
public class VerticalSlice extends IntensityProfile<Double> {

    private final Instant time;

    VerticalSlice(Instant time, List<Double> angles, double[] intensities, Double calibrationFactor) {
        super(angles, intensities, calibrationFactor);
        this.time = time;
    }

    public Instant getTime() {
        return time;
    }

    public List<Double> getAngles() {
        return getPositions();
    }

    @Override
    public String toString() {
        return "VerticalSlice{" + "time=" + time + ", size=" + size() + '}';
    }
}
