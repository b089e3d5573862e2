package org.allsky.keogram;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.allsky.keogram.image.PixelBuffer;
import org.allsky.keogram.projection.TimeMapper;

/**
 * Joins keograms together along the time axis.
 */
public final class KeogramCombiner {

    private static final Logger LOG = Logger.getLogger(KeogramCombiner.class.getName());

    private KeogramCombiner() {
    }

    /**
     * Combine keograms into a single keogram covering all of their data. The
     * width of the result is worked out afresh from the times of the data in
     * the keograms.
     *
     * @param keograms The keograms, which must be compatible
     * @param dataSpacing The data spacing of the result
     * @return The combined keogram
     * @throws IncompatibleKeogramsException If the keograms differ in
     * anything but their time axis
     */
    public static Keogram combine(List<Keogram> keograms, DataSpacing dataSpacing) {
        if (keograms.isEmpty()) {
            throw new EmptyDatasetException();
        }
        checkCompatible(keograms);
        List<Instant> times = new ArrayList<>();
        for (Keogram keogram : keograms) {
            times.addAll(keogram.getDataTimes());
        }
        if (times.isEmpty()) {
            throw new DataInsufficientException("The keograms to combine hold no data");
        }
        Keogram reference = keograms.get(0);
        Instant start = Collections.min(times);
        Instant end = Collections.max(times);
        if (start.equals(end)) {
            end = end.plus(Duration.ofHours(1));
        }
        KeogramGeometry.TimeAxis axis = KeogramGeometry.TimeAxis.compute(times, start, end, reference.getStripWidth(), dataSpacing);
        KeogramGeometry geometry = new KeogramGeometry(reference.getMode(), reference.getColourTable(), reference.getLensProjection(),
                reference.getCalibrationFactor(), reference.getAngle(), reference.getStripWidth(), reference.getKeoType(),
                start, end, axis.width, reference.getHeight(), reference.getFovRange(), axis.dataSpacing);
        return merge(keograms, geometry);
    }

    /**
     * Copy the strips of several keograms into one keogram of the given
     * geometry, then interpolate the result. Keograms sharing the time axis of
     * the geometry are copied column for column, others are re-mapped through
     * the times of their data points. Where strips overlap, later keograms in
     * the list win.
     *
     * @param keograms Un-interpolated keograms, in time order
     * @param geometry The geometry of the result
     * @return The merged keogram
     */
    public static Keogram merge(List<Keogram> keograms, KeogramGeometry geometry) {
        if (keograms.isEmpty()) {
            throw new EmptyDatasetException();
        }
        checkCompatible(keograms);
        PixelBuffer buffer = new PixelBuffer(geometry.getMode(), geometry.getWidth(), geometry.getHeight());
        TimeMapper timeMapper = geometry.timeMapper();
        int stripWidth = geometry.getStripWidth();
        int columns = geometry.getKeoType().interpolationWidth(stripWidth);
        List<Double> points = new ArrayList<>();
        for (Keogram keogram : keograms) {
            if (keogram.getHeight() != geometry.getHeight() || keogram.getMode() != geometry.getMode()) {
                throw new IncompatibleKeogramsException("heights or modes");
            }
            boolean sameAxis = keogram.getWidth() == geometry.getWidth() && keogram.getStripWidth() == stripWidth
                    && keogram.getStartTime().equals(geometry.getStart()) && keogram.getEndTime().equals(geometry.getEnd());
            PixelBuffer data = keogram.getData();
            for (double p : keogram.getDataPoints()) {
                double x = sameAxis ? p : timeMapper.timeToPixel(keogram.getTimeMapper().pixelToTime(p));
                if (x < 0 || x >= geometry.getWidth()) {
                    LOG.log(Level.FINE, "Dropping data point {0}, outside merged keogram", x);
                    continue;
                }
                int source = (int) Math.round(p) - columns / 2;
                int target = (int) Math.round(x) - columns / 2;
                buffer.copyColumns(data, source, target, columns);
                points.add(x);
            }
        }
        double[] dataPoints = new double[points.size()];
        for (int i = 0; i < dataPoints.length; i++) {
            dataPoints[i] = points.get(i);
        }
        return Keogram.assemble(buffer, geometry, dataPoints, geometry.interpolator());
    }

    static void checkCompatible(List<Keogram> keograms) {
        Keogram reference = keograms.get(0);
        for (Keogram keogram : keograms) {
            if (keogram.getMode() != reference.getMode()) {
                throw new IncompatibleKeogramsException("modes");
            }
            if (!keogram.getFovRange().equals(reference.getFovRange())) {
                throw new IncompatibleKeogramsException("fields of view");
            }
            if (!Objects.equals(keogram.getCalibrationFactor(), reference.getCalibrationFactor())) {
                throw new IncompatibleKeogramsException("calibration factors");
            }
            if (!Objects.equals(keogram.getColourTable(), reference.getColourTable())) {
                throw new IncompatibleKeogramsException("colour tables");
            }
            if (keogram.getStripWidth() != reference.getStripWidth()) {
                throw new IncompatibleKeogramsException("strip widths");
            }
            if (keogram.getKeoType() != reference.getKeoType()) {
                throw new IncompatibleKeogramsException("keogram types");
            }
            if (keogram.getHeight() != reference.getHeight()) {
                throw new IncompatibleKeogramsException("heights");
            }
            if (Double.compare(keogram.getAngle(), reference.getAngle()) != 0) {
                throw new IncompatibleKeogramsException("angles");
            }
            if (keogram.getLensProjection() != reference.getLensProjection()) {
                throw new IncompatibleKeogramsException("lens projections");
            }
        }
    }
}
