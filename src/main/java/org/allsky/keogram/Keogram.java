package org.allsky.keogram;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.allsky.keogram.cmap.ColourTable;
import org.allsky.keogram.image.AllskyImage;
import org.allsky.keogram.image.ImageInfo;
import org.allsky.keogram.image.ImageSource;
import org.allsky.keogram.image.Mode;
import org.allsky.keogram.image.PixelBuffer;
import org.allsky.keogram.interp.Interpolator;
import org.allsky.keogram.projection.AngleMapper;
import org.allsky.keogram.projection.FovRange;
import org.allsky.keogram.projection.LensProjection;
import org.allsky.keogram.projection.TimeMapper;
import org.allsky.keogram.strip.StripExtractor;

/**
 * A keogram: strips cut from a time ordered sequence of all-sky images, laid
 * side by side along a time axis. Columns are time, rows are angle across the
 * sky along the azimuth the strips were cut at.
 * <p>
 * Keograms are immutable. Every transform returns a new keogram, and methods
 * returning pixel data return copies.
 */
public class Keogram {

    private static final Logger LOG = Logger.getLogger(Keogram.class.getName());

    private final PixelBuffer data;
    private final Instant startTime;
    private final Instant endTime;
    private final double angle;
    private final FovRange fovRange;
    private final LensProjection lensProjection;
    private final int stripWidth;
    private final KeoType keoType;
    private final double[] dataPoints;
    private final int dataSpacing;
    private final ColourTable colourTable;
    private final Double calibrationFactor;
    private final TimeMapper timeMapper;
    private final AngleMapper angleMapper;

    /**
     * Create a keogram from its parts.
     *
     * @param data The pixels, width x height
     * @param startTime Time of the first strip position
     * @param endTime Time of the last strip position
     * @param angle Azimuth the strips were cut at
     * @param fovRange Angles spanned by the vertical axis
     * @param lensProjection Projection of the vertical axis
     * @param stripWidth Width reserved for each strip along the time axis
     * @param keoType How strips were placed
     * @param dataPoints Sorted, unique columns holding real data
     * @param dataSpacing Typical spacing of the data points, in pixels
     * @param colourTable Palette, or null
     * @param calibrationFactor Conversion of pixel values to kR, or null
     */
    public Keogram(PixelBuffer data, Instant startTime, Instant endTime, double angle, FovRange fovRange,
            LensProjection lensProjection, int stripWidth, KeoType keoType, double[] dataPoints, int dataSpacing,
            ColourTable colourTable, Double calibrationFactor) {
        this(data, startTime, endTime, angle, fovRange, lensProjection, stripWidth, keoType, dataPoints,
                dataSpacing, colourTable, calibrationFactor, true);
    }

    /**
     * Without copyData the keogram takes ownership of the buffer, which must
     * not be modified afterwards.
     */
    private Keogram(PixelBuffer data, Instant startTime, Instant endTime, double angle, FovRange fovRange,
            LensProjection lensProjection, int stripWidth, KeoType keoType, double[] dataPoints, int dataSpacing,
            ColourTable colourTable, Double calibrationFactor, boolean copyData) {
        this.data = copyData ? data.copy() : data;
        this.startTime = startTime;
        this.endTime = endTime;
        this.angle = angle;
        this.fovRange = Objects.requireNonNull(fovRange);
        this.lensProjection = Objects.requireNonNull(lensProjection);
        this.stripWidth = stripWidth;
        this.keoType = Objects.requireNonNull(keoType);
        this.dataPoints = dataPoints.clone();
        this.dataSpacing = dataSpacing;
        this.colourTable = colourTable;
        this.calibrationFactor = calibrationFactor;
        this.timeMapper = new TimeMapper(startTime, endTime, data.getWidth(), stripWidth);
        this.angleMapper = lensProjection.mapper(data.getHeight(), fovRange);
        for (int i = 0; i < this.dataPoints.length; i++) {
            double p = this.dataPoints[i];
            if (!(p >= 0 && p < data.getWidth())) {
                throw new IllegalArgumentException("Data point " + p + " outside keogram of width " + data.getWidth());
            }
            if (i > 0 && p <= this.dataPoints[i - 1]) {
                throw new IllegalArgumentException("Data points must be sorted and unique");
            }
        }
    }

    Keogram(PixelBuffer data, KeogramGeometry geometry, double[] dataPoints) {
        this(data, geometry.getStart(), geometry.getEnd(), geometry.getAngle(), geometry.getFovRange(),
                geometry.getLensProjection(), geometry.getStripWidth(), geometry.getKeoType(), dataPoints,
                geometry.getDataSpacing(), geometry.getColourTable(), geometry.getCalibrationFactor(), false);
    }

    private Keogram with(PixelBuffer newData, Instant newStart, Instant newEnd, FovRange newFov, double[] newPoints) {
        return new Keogram(newData, newStart, newEnd, angle, newFov, lensProjection, stripWidth, keoType, newPoints,
                dataSpacing, colourTable, calibrationFactor, false);
    }

    /**
     * Wrap placed strips as a keogram of the given geometry, after sorting
     * the data points and filling the gaps between them.
     */
    static Keogram assemble(PixelBuffer buffer, KeogramGeometry geometry, double[] dataPoints, Interpolator interpolator) {
        double[] points = sortedUnique(dataPoints);
        KeoType type = geometry.getKeoType();
        interpolator.interpolate(buffer, roundPoints(points), type.interpolationWidth(geometry.getStripWidth()), geometry.maxGap());
        return new Keogram(buffer, geometry, points);
    }

    static int[] roundPoints(double[] dataPoints) {
        int[] rounded = new int[dataPoints.length];
        int n = 0;
        for (double p : dataPoints) {
            int r = (int) Math.round(p);
            if (n == 0 || rounded[n - 1] != r) {
                rounded[n++] = r;
            }
        }
        return Arrays.copyOf(rounded, n);
    }

    static double[] sortedUnique(double[] points) {
        double[] sorted = points.clone();
        Arrays.sort(sorted);
        int n = 0;
        for (double p : sorted) {
            if (n == 0 || sorted[n - 1] != p) {
                sorted[n++] = p;
            }
        }
        return Arrays.copyOf(sorted, n);
    }

    public int getWidth() {
        return data.getWidth();
    }

    public int getHeight() {
        return data.getHeight();
    }

    public Mode getMode() {
        return data.getMode();
    }

    /**
     * @return A copy of the keogram pixels
     */
    public PixelBuffer getData() {
        return data.copy();
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public double getAngle() {
        return angle;
    }

    public FovRange getFovRange() {
        return fovRange;
    }

    public LensProjection getLensProjection() {
        return lensProjection;
    }

    public int getStripWidth() {
        return stripWidth;
    }

    public KeoType getKeoType() {
        return keoType;
    }

    /**
     * The un-rounded columns at which strips were placed.
     *
     * @return A copy of the data points
     */
    public double[] getDataPoints() {
        return dataPoints.clone();
    }

    public int getDataSpacing() {
        return dataSpacing;
    }

    public ColourTable getColourTable() {
        return colourTable;
    }

    public Double getCalibrationFactor() {
        return calibrationFactor;
    }

    public TimeMapper getTimeMapper() {
        return timeMapper;
    }

    public AngleMapper getAngleMapper() {
        return angleMapper;
    }

    /**
     * @return The capture times of the images in the keogram
     */
    public List<Instant> getDataTimes() {
        List<Instant> times = new ArrayList<>(dataPoints.length);
        for (double p : dataPoints) {
            times.add(timeMapper.pixelToTime(p));
        }
        return Collections.unmodifiableList(times);
    }

    /**
     * Convert an angle to a (fractional) row.
     *
     * @param angle The angle, in degrees
     * @return The row, or null if the angle is outside the keogram
     */
    public Double angle2pix(double angle) {
        if (!fovRange.contains(angle)) {
            return null;
        }
        return angleMapper.angleToPixel(angle);
    }

    public Double pix2angle(double pixel) {
        if (pixel < 0 || pixel > getHeight() - 1) {
            return null;
        }
        return angleMapper.pixelToAngle(pixel);
    }

    /**
     * Convert a time to a (fractional) column.
     *
     * @param time The time
     * @return The column, or null if the time is outside the keogram
     */
    public Double time2pix(Instant time) {
        if (time.isBefore(startTime) || time.isAfter(endTime)) {
            return null;
        }
        return timeMapper.timeToPixel(time);
    }

    public Instant pix2time(double pixel) {
        if (pixel < 0 || pixel > getWidth() - 1) {
            return null;
        }
        return timeMapper.pixelToTime(pixel);
    }

    /**
     * Crop the keogram to a smaller field of view.
     *
     * @param range The new field of view, which must lie inside the current
     * one
     * @return The cropped keogram
     * @throws RangeException If the range is not inside the current field of
     * view
     */
    public Keogram zoomFov(FovRange range) {
        if (!fovRange.contains(range)) {
            throw new RangeException("Field of view " + range + " is outside the keogram field of view " + fovRange);
        }
        if (fovRange.equals(range)) {
            return with(data.copy(), startTime, endTime, fovRange, dataPoints);
        }
        int lower = (int) Math.round(angleMapper.angleToPixel(range.getMin()));
        int upper = (int) Math.round(angleMapper.angleToPixel(range.getMax()));
        int rows = upper - lower + 1;
        if (rows < 2) {
            throw new RangeException("Field of view " + range + " is narrower than the keogram resolution");
        }
        return with(data.crop(0, lower, getWidth(), rows), startTime, endTime, range, dataPoints);
    }

    /**
     * Crop the keogram to a shorter time window. The window is clamped to the
     * time range of the keogram.
     *
     * @param start Start of the window
     * @param end End of the window
     * @return The cropped keogram
     * @throws RangeException If the window does not overlap the keogram
     */
    public Keogram zoomTime(Instant start, Instant end) {
        if (!start.isBefore(end)) {
            throw new RangeException("Start time " + start + " must be before end time " + end);
        }
        if (end.isBefore(startTime) || start.isAfter(endTime)) {
            throw new RangeException("Window " + start + " - " + end + " does not overlap keogram " + startTime + " - " + endTime);
        }
        Instant newStart = start.isBefore(startTime) ? startTime : start;
        Instant newEnd = end.isAfter(endTime) ? endTime : end;
        if (!newStart.isBefore(newEnd)) {
            throw new RangeException("Window " + start + " - " + end + " only touches keogram " + startTime + " - " + endTime);
        }
        int startPix = (int) Math.round(timeMapper.timeToPixel(newStart));
        int endPix = (int) Math.round(timeMapper.timeToPixel(newEnd));
        int newWidth = endPix - startPix + stripWidth;
        if (newWidth <= stripWidth) {
            throw new RangeException("Window " + newStart + " - " + newEnd + " is shorter than one column of the keogram");
        }
        PixelBuffer cropped = data.crop(startPix - stripWidth / 2, 0, newWidth, getHeight());

        TimeMapper newMapper = new TimeMapper(newStart, newEnd, newWidth, stripWidth);
        List<Double> points = new ArrayList<>();
        for (double p : dataPoints) {
            Instant time = timeMapper.pixelToTime(p);
            if (!time.isBefore(newStart) && !time.isAfter(newEnd)) {
                double x = newMapper.timeToPixel(time);
                if (x >= 0 && x < newWidth) {
                    points.add(x);
                }
            }
        }
        return with(cropped, newStart, newEnd, fovRange, sortedUnique(toArray(points)));
    }

    /**
     * Roll the keogram along the time axis to take in new images, keeping
     * its width. Rolling forward drops data from the start of the keogram,
     * rolling backward drops data from the end.
     *
     * @param images The new images
     * @return The rolled keogram
     * @throws IncompatibleImagesException If the images do not match the
     * keogram
     * @throws RangeException If the images lie both before and after the
     * keogram
     */
    public Keogram roll(ImageSource images) {
        if (images.isEmpty()) {
            return with(data.copy(), startTime, endTime, fovRange, dataPoints);
        }
        List<Instant> times = new ArrayList<>(images.size());
        for (int i = 0; i < images.size(); i++) {
            ImageInfo info = images.getInfo(i);
            KeogramGeometry.checkCompatible(getMode(), colourTable, lensProjection, calibrationFactor, info);
            times.add(info.getCaptureTime());
        }
        Instant earliest = Collections.min(times);
        Instant latest = Collections.max(times);
        if (earliest.isBefore(startTime) && latest.isAfter(endTime)) {
            throw new RangeException("Cannot roll keogram both forwards and backwards, images span " + earliest + " - " + latest);
        }
        Duration timeRoll;
        if (latest.isAfter(endTime)) {
            timeRoll = Duration.between(endTime, latest);
        } else if (earliest.isBefore(startTime)) {
            timeRoll = Duration.between(startTime, earliest);
        } else {
            timeRoll = Duration.ZERO;
        }
        double span = TimeMapper.seconds(Duration.between(startTime, endTime));
        long pixRoll = Math.round(TimeMapper.seconds(timeRoll) * (getWidth() - stripWidth) / span);
        int intPixRoll = (int) Math.max(-getWidth(), Math.min(getWidth(), pixRoll));
        LOG.log(Level.FINE, "Rolling keogram by {0} ({1} columns)", new Object[]{timeRoll, intPixRoll});

        PixelBuffer rolled = new PixelBuffer(getMode(), getWidth(), getHeight());
        rolled.copyColumns(data, 0, -intPixRoll, getWidth());
        // Data points move by whole columns, so they may sit up to half a
        // column away from where the rolled time mapping puts their images.
        List<Double> points = new ArrayList<>();
        for (double p : dataPoints) {
            double shifted = p - intPixRoll;
            if (shifted >= 0 && shifted < getWidth()) {
                points.add(shifted);
            }
        }

        Instant newStart = startTime.plus(timeRoll);
        Instant newEnd = endTime.plus(timeRoll);
        KeogramGeometry geometry = new KeogramGeometry(getMode(), colourTable, lensProjection, calibrationFactor, angle,
                stripWidth, keoType, newStart, newEnd, getWidth(), getHeight(), fovRange, dataSpacing);
        Accumulator accumulator = new Accumulator(rolled, geometry.timeMapper(), keoType);
        StripExtractor extractor = geometry.stripExtractor();
        for (int i = 0; i < images.size(); i++) {
            ImageInfo info = images.getInfo(i);
            if (!geometry.contains(info.getCaptureTime())) {
                LOG.log(Level.FINE, "Skipping image captured at {0}, outside rolled keogram", info.getCaptureTime());
                continue;
            }
            AllskyImage image = images.getImage(i);
            points.add(accumulator.putStrip(extractor.extract(image), info.getCaptureTime()));
        }
        return assemble(rolled, geometry, toArray(points), geometry.interpolator());
    }

    /**
     * Intensities along the time axis at a fixed angle, averaged over a band
     * of rows. Zero (missing) pixels are excluded from the average.
     *
     * @param angle The angle
     * @param stripWidth Number of rows to average, or null for one degree
     * @return The profile, or null if the angle is outside the keogram
     */
    public HorizontalSlice getIntensitiesAt(double angle, Integer stripWidth) {
        checkIntensityMode();
        if (!fovRange.contains(angle)) {
            return null;
        }
        int rows;
        if (stripWidth == null) {
            rows = (int) Math.round(Math.abs(angleMapper.angleToPixel(angle + 0.5) - angleMapper.angleToPixel(angle - 0.5)));
            rows = Math.max(1, rows);
        } else {
            rows = stripWidth;
        }
        int y = (int) Math.round(angleMapper.angleToPixel(angle));
        int lower = Math.max(0, y - rows / 2);
        int upper = Math.min(getHeight() - 1, y + rows / 2);

        double[] intensities = new double[getWidth()];
        List<Instant> times = new ArrayList<>(getWidth());
        for (int x = 0; x < getWidth(); x++) {
            intensities[x] = meanExcludingZeros(x, x, lower, upper);
            times.add(timeMapper.pixelToTime(x));
        }
        return new HorizontalSlice(angle, times, intensities, calibrationFactor);
    }

    public HorizontalSlice getIntensitiesAt(double angle) {
        return getIntensitiesAt(angle, null);
    }

    /**
     * Intensities along the angle axis at a fixed time, averaged over a band
     * of columns. Zero (missing) pixels are excluded from the average.
     *
     * @param time The time
     * @param stripWidth Number of columns to average, or null for the strip
     * width of the keogram
     * @return The profile, or null if the time is outside the keogram
     */
    public VerticalSlice getIntensitiesAt(Instant time, Integer stripWidth) {
        checkIntensityMode();
        if (time.isBefore(timeMapper.pixelToTime(0)) || time.isAfter(timeMapper.pixelToTime(getWidth() - 1))) {
            return null;
        }
        int columns = stripWidth == null ? this.stripWidth : stripWidth;
        int x = (int) Math.round(timeMapper.timeToPixel(time));
        int lower = Math.max(0, x - columns / 2);
        int upper = Math.min(getWidth() - 1, x + columns / 2);

        double[] intensities = new double[getHeight()];
        List<Double> angles = new ArrayList<>(getHeight());
        for (int y = 0; y < getHeight(); y++) {
            intensities[y] = meanExcludingZeros(lower, upper, y, y);
            angles.add(angleMapper.pixelToAngle(y));
        }
        return new VerticalSlice(time, angles, intensities, calibrationFactor);
    }

    public VerticalSlice getIntensitiesAt(Instant time) {
        return getIntensitiesAt(time, null);
    }

    private void checkIntensityMode() {
        if (getMode() == Mode.RGB) {
            throw new UnsupportedOperationException("Cannot resolve intensities for an RGB keogram");
        }
    }

    private double meanExcludingZeros(int x0, int x1, int y0, int y1) {
        long sum = 0;
        int count = 0;
        for (int x = x0; x <= x1; x++) {
            for (int y = y0; y <= y1; y++) {
                int value = data.get(x, y, 0);
                if (value != 0) {
                    sum += value;
                    count++;
                }
            }
        }
        return count == 0 ? 0 : (double) sum / count;
    }

    /**
     * Attach a colour table to the keogram.
     *
     * @param table The colour table
     * @return A new keogram with the colour table
     * @throws CompatibilityException For RGB keograms
     */
    public Keogram applyColourTable(ColourTable table) {
        if (getMode() == Mode.RGB) {
            throw new CompatibilityException("Cannot apply a colour table to an RGB keogram");
        }
        return new Keogram(data.copy(), startTime, endTime, angle, fovRange, lensProjection, stripWidth, keoType,
                dataPoints, dataSpacing, table, calibrationFactor, false);
    }

    /**
     * Calibrate the keogram to kR.
     *
     * @param spectralResponsivity Responsivity of the camera, counts per
     * Rayleigh per second
     * @param exposureTime Exposure time in seconds
     * @return A new keogram with the calibration factor set
     * @throws CompatibilityException For RGB keograms
     */
    public Keogram absoluteCalibration(double spectralResponsivity, double exposureTime) {
        if (getMode() == Mode.RGB) {
            throw new CompatibilityException("No intensity data available for an RGB keogram");
        }
        double factor = 1.0 / (spectralResponsivity * exposureTime * 1000);
        return new Keogram(data.copy(), startTime, endTime, angle, fovRange, lensProjection, stripWidth, keoType,
                dataPoints, dataSpacing, colourTable, factor, false);
    }

    /**
     * Histogram of the pixel values: 256 bins for L keograms, 65536 for I
     * keograms. Values beyond the last bin are counted in it, negative values
     * in the first.
     *
     * @return The bin counts
     */
    public long[] histogram() {
        int bins;
        switch (getMode()) {
            case L:
                bins = 256;
                break;
            case I:
                bins = 65536;
                break;
            default:
                throw new UnsupportedOperationException("Histogram not supported for " + getMode() + " keograms");
        }
        long[] counts = new long[bins];
        for (int x = 0; x < getWidth(); x++) {
            for (int y = 0; y < getHeight(); y++) {
                int value = data.get(x, y, 0);
                counts[Math.max(0, Math.min(bins - 1, value))]++;
            }
        }
        return counts;
    }

    /**
     * Replace each pixel by the median of the n x n box around it, channel by
     * channel. The box is truncated at the edges of the keogram.
     *
     * @param n Size of the box, even sizes are increased by one
     * @return The filtered keogram
     */
    public Keogram medianFilter(int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("Filter size must be positive, got " + n);
        }
        if (n % 2 == 0) {
            n++;
        }
        int half = n / 2;
        PixelBuffer filtered = new PixelBuffer(getMode(), getWidth(), getHeight());
        int[] window = new int[n * n];
        for (int x = 0; x < getWidth(); x++) {
            for (int y = 0; y < getHeight(); y++) {
                for (int c = 0; c < data.getChannels(); c++) {
                    int count = 0;
                    for (int i = Math.max(0, x - half); i <= Math.min(getWidth() - 1, x + half); i++) {
                        for (int j = Math.max(0, y - half); j <= Math.min(getHeight() - 1, y + half); j++) {
                            window[count++] = data.get(i, j, c);
                        }
                    }
                    Arrays.sort(window, 0, count);
                    filtered.set(x, y, c, window[count / 2]);
                }
            }
        }
        return with(filtered, startTime, endTime, fovRange, dataPoints);
    }

    private static double[] toArray(List<Double> list) {
        double[] result = new double[list.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = list.get(i);
        }
        return result;
    }

    @Override
    public String toString() {
        return "Keogram{" + "mode=" + getMode() + ", width=" + getWidth() + ", height=" + getHeight() + ", startTime=" + startTime + ", endTime=" + endTime + ", angle=" + angle + ", fovRange=" + fovRange + ", keoType=" + keoType + ", dataPoints=" + dataPoints.length + '}';
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 79 * hash + Objects.hashCode(this.data);
        hash = 79 * hash + Objects.hashCode(this.startTime);
        hash = 79 * hash + Objects.hashCode(this.endTime);
        hash = 79 * hash + Double.hashCode(this.angle);
        hash = 79 * hash + Objects.hashCode(this.fovRange);
        hash = 79 * hash + Objects.hashCode(this.lensProjection);
        hash = 79 * hash + this.stripWidth;
        hash = 79 * hash + Objects.hashCode(this.keoType);
        hash = 79 * hash + Arrays.hashCode(this.dataPoints);
        hash = 79 * hash + this.dataSpacing;
        hash = 79 * hash + Objects.hashCode(this.colourTable);
        hash = 79 * hash + Objects.hashCode(this.calibrationFactor);
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
        final Keogram other = (Keogram) obj;
        return Double.compare(this.angle, other.angle) == 0
                && this.stripWidth == other.stripWidth
                && this.dataSpacing == other.dataSpacing
                && this.keoType == other.keoType
                && this.lensProjection == other.lensProjection
                && Objects.equals(this.startTime, other.startTime)
                && Objects.equals(this.endTime, other.endTime)
                && Objects.equals(this.fovRange, other.fovRange)
                && Objects.equals(this.colourTable, other.colourTable)
                && Objects.equals(this.calibrationFactor, other.calibrationFactor)
                && Arrays.equals(this.dataPoints, other.dataPoints)
                && Objects.equals(this.data, other.data);
    }
}
