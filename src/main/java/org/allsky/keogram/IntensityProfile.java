package org.allsky.keogram;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A line of intensities taken through a keogram. Missing data is reported as
 * zero intensity.
 *
 * @param <P> The type of the positions along the profile
 */
public abstract class IntensityProfile<P> {

    private final List<P> positions;
    private final double[] intensities;
    private final Double calibrationFactor;

    IntensityProfile(List<P> positions, double[] intensities, Double calibrationFactor) {
        if (positions.size() != intensities.length) {
            throw new IllegalArgumentException("Positions and intensities differ in length");
        }
        this.positions = Collections.unmodifiableList(new ArrayList<>(positions));
        this.intensities = intensities.clone();
        this.calibrationFactor = calibrationFactor;
    }

    public int size() {
        return intensities.length;
    }

    public List<P> getPositions() {
        return positions;
    }

    /**
     * @return The intensities as stored in the keogram (pixel values)
     */
    public double[] getRawIntensities() {
        return intensities.clone();
    }

    public boolean isCalibrated() {
        return calibrationFactor != null;
    }

    public Double getCalibrationFactor() {
        return calibrationFactor;
    }

    /**
     * Intensities converted to kR using the calibration factor of the keogram.
     *
     * @return The calibrated intensities
     * @throws IllegalStateException If the keogram was not calibrated
     */
    public double[] getCalibratedIntensities() {
        if (calibrationFactor == null) {
            throw new IllegalStateException("Keogram has not been calibrated");
        }
        double[] result = new double[intensities.length];
        for (int i = 0; i < result.length; i++) {
            result[i] = intensities[i] * calibrationFactor;
        }
        return result;
    }
}
