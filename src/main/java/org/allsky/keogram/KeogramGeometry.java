package org.allsky.keogram;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.allsky.keogram.cmap.ColourTable;
import org.allsky.keogram.image.ImageInfo;
import org.allsky.keogram.image.ImageSource;
import org.allsky.keogram.image.Mode;
import org.allsky.keogram.interp.Interpolator;
import org.allsky.keogram.projection.AngleMapper;
import org.allsky.keogram.projection.FovRange;
import org.allsky.keogram.projection.LensProjection;
import org.allsky.keogram.projection.TimeMapper;
import org.allsky.keogram.strip.StripExtractor;

/**
 * The shape of a keogram: its pixel size, time window, field of view and
 * everything else needed to place strips into it. A geometry is planned once
 * from the metadata of the images and then shared by every worker taking part
 * in a build, so that partial keograms line up exactly.
 */
public final class KeogramGeometry {

    private static final Logger LOG = Logger.getLogger(KeogramGeometry.class.getName());
    private static final Duration SINGLE_IMAGE_SPAN = Duration.ofHours(1);

    private final Mode mode;
    private final ColourTable colourTable;
    private final LensProjection lensProjection;
    private final Double calibrationFactor;
    private final double angle;
    private final int extractionWidth;
    private final KeoType keoType;
    private final Instant start;
    private final Instant end;
    private final int width;
    private final int height;
    private final FovRange fovRange;
    private final int dataSpacing;

    KeogramGeometry(Mode mode, ColourTable colourTable, LensProjection lensProjection, Double calibrationFactor,
            double angle, int extractionWidth, KeoType keoType, Instant start, Instant end,
            int width, int height, FovRange fovRange, int dataSpacing) {
        this.mode = mode;
        this.colourTable = colourTable;
        this.lensProjection = lensProjection;
        this.calibrationFactor = calibrationFactor;
        this.angle = angle;
        this.extractionWidth = extractionWidth;
        this.keoType = keoType;
        this.start = start;
        this.end = end;
        this.width = width;
        this.height = height;
        this.fovRange = fovRange;
        this.dataSpacing = dataSpacing;
    }

    /**
     * Work out the geometry of a keogram built from the given images. Only
     * image metadata is used, no pixels are read.
     *
     * @param source The images
     * @param param The build parameters
     * @return The geometry
     * @throws EmptyDatasetException If the source holds no images
     * @throws IncompatibleImagesException If the images cannot be combined
     * @throws NoDataInRangeException If no image falls in the time window
     * @throws DataInsufficientException If the data spacing cannot be
     * estimated
     */
    public static KeogramGeometry plan(ImageSource source, KeogramBuildParam param) {
        if (source.isEmpty()) {
            throw new EmptyDatasetException();
        }
        ImageInfo reference = source.getInfo(0);
        List<Instant> times = new ArrayList<>(source.size());
        double maxFov = 0;
        int maxRadius = 0;
        for (int i = 0; i < source.size(); i++) {
            ImageInfo info = source.getInfo(i);
            checkCompatible(reference, info);
            times.add(info.getCaptureTime());
            maxFov = Math.max(maxFov, info.getFovAngle());
            maxRadius = Math.max(maxRadius, info.getRadius());
        }
        Instant first = Collections.min(times);
        Instant last = Collections.max(times);

        Instant start = param.getStart() == null ? first : param.getStart();
        Instant end = param.getEnd() == null ? last : param.getEnd();
        if (start.isAfter(last) || end.isBefore(first)) {
            throw new NoDataInRangeException("The images are outside of the time range " + start + " - " + end);
        }
        if (start.isAfter(end)) {
            throw new RangeException("Start time " + start + " is after end time " + end);
        }
        if (start.equals(end)) {
            end = end.plus(SINGLE_IMAGE_SPAN);
        }
        List<Instant> inWindow = new ArrayList<>();
        for (Instant time : times) {
            if (!time.isBefore(start) && !time.isAfter(end)) {
                inWindow.add(time);
            }
        }
        if (inWindow.isEmpty()) {
            throw new NoDataInRangeException("No images between " + start + " and " + end);
        }

        KeoType keoType = param.getKeoType();
        int placementWidth = keoType.placementWidth(param.getStripWidth());
        TimeAxis axis = TimeAxis.compute(inWindow, start, end, placementWidth, param.getDataSpacing());

        FovRange imageFov = FovRange.aroundZenith(maxFov);
        FovRange fovRange = param.getFovRange() == null ? imageFov : param.getFovRange();
        AngleMapper imageMapper = reference.getLensProjection().mapper(2 * maxRadius, imageFov);
        int height = (int) Math.round(imageMapper.angleToPixel(fovRange.getMax()) - imageMapper.angleToPixel(fovRange.getMin())) + 1;
        if (height < 2) {
            throw new ConfigurationException("Field of view " + fovRange + " is too narrow for the images");
        }

        KeogramGeometry geometry = new KeogramGeometry(reference.getMode(), reference.getColourTable(), reference.getLensProjection(),
                reference.getCalibrationFactor(), param.getAngle(), param.getStripWidth(), keoType, start, end,
                axis.width, height, fovRange, axis.dataSpacing);
        LOG.log(Level.FINE, "Planned {0} for {1} images", new Object[]{geometry, inWindow.size()});
        return geometry;
    }

    /**
     * Check that an image can go into the same keogram as a reference image.
     *
     * @throws IncompatibleImagesException If they differ in mode, colour
     * table, lens projection or calibration
     */
    static void checkCompatible(ImageInfo reference, ImageInfo info) {
        checkCompatible(reference.getMode(), reference.getColourTable(), reference.getLensProjection(), reference.getCalibrationFactor(), info);
    }

    static void checkCompatible(Mode mode, ColourTable colourTable, LensProjection lensProjection, Double calibrationFactor, ImageInfo info) {
        if (mode != info.getMode()) {
            throw new IncompatibleImagesException("Image captured at " + info.getCaptureTime() + " has mode " + info.getMode() + ", expected " + mode);
        }
        if (!Objects.equals(colourTable, info.getColourTable())) {
            throw new IncompatibleImagesException("Image captured at " + info.getCaptureTime() + " has a different colour table");
        }
        if (lensProjection != info.getLensProjection()) {
            throw new IncompatibleImagesException("Image captured at " + info.getCaptureTime() + " has lens projection " + info.getLensProjection() + ", expected " + lensProjection);
        }
        if (!Objects.equals(calibrationFactor, info.getCalibrationFactor())) {
            throw new IncompatibleImagesException("Image captured at " + info.getCaptureTime() + " has calibration factor " + info.getCalibrationFactor() + ", expected " + calibrationFactor);
        }
    }

    /**
     * Width of the strip reserved for each image along the time axis.
     *
     * @return The placement width
     */
    public int getStripWidth() {
        return keoType.placementWidth(extractionWidth);
    }

    public TimeMapper timeMapper() {
        return new TimeMapper(start, end, width, getStripWidth());
    }

    public StripExtractor stripExtractor() {
        return new StripExtractor(angle, extractionWidth, fovRange, height, colourTable != null);
    }

    public int maxGap() {
        return keoType.maxGap(dataSpacing);
    }

    /**
     * The interpolator used to fill gaps in a complete keogram of this
     * geometry.
     */
    public Interpolator interpolator() {
        return Interpolator.forKeogram(mode, colourTable);
    }

    public boolean contains(Instant time) {
        return !time.isBefore(start) && !time.isAfter(end);
    }

    public Mode getMode() {
        return mode;
    }

    public ColourTable getColourTable() {
        return colourTable;
    }

    public LensProjection getLensProjection() {
        return lensProjection;
    }

    public Double getCalibrationFactor() {
        return calibrationFactor;
    }

    public double getAngle() {
        return angle;
    }

    public int getExtractionWidth() {
        return extractionWidth;
    }

    public KeoType getKeoType() {
        return keoType;
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public FovRange getFovRange() {
        return fovRange;
    }

    /**
     * @return Typical spacing between data points, in pixels
     */
    public int getDataSpacing() {
        return dataSpacing;
    }

    @Override
    public String toString() {
        return "KeogramGeometry{" + "mode=" + mode + ", width=" + width + ", height=" + height + ", start=" + start + ", end=" + end + ", fovRange=" + fovRange + ", keoType=" + keoType + ", dataSpacing=" + dataSpacing + '}';
    }

    /**
     * Width of the time axis and typical data spacing in pixels. The width is
     * chosen so that there are at least two strip widths between the closest
     * pair of images, leaving room for interpolation.
     */
    static class TimeAxis {

        final int width;
        final int dataSpacing;

        private TimeAxis(int width, int dataSpacing) {
            this.width = width;
            this.dataSpacing = dataSpacing;
        }

        static TimeAxis compute(List<Instant> times, Instant start, Instant end, int placementWidth, DataSpacing spacing) {
            List<Instant> unique = new ArrayList<>(new TreeSet<>(times));
            double minSpacing;
            double medianSpacing;
            if (spacing.isAuto()) {
                if (unique.size() < 2) {
                    throw new DataInsufficientException("Not enough images to allow automatic data spacing calculation");
                }
                double[] gaps = new double[unique.size() - 1];
                for (int i = 1; i < unique.size(); i++) {
                    gaps[i - 1] = TimeMapper.seconds(Duration.between(unique.get(i - 1), unique.get(i)));
                }
                Arrays.sort(gaps);
                minSpacing = gaps[0];
                int mid = gaps.length / 2;
                medianSpacing = gaps.length % 2 == 1 ? gaps[mid] : (gaps[mid - 1] + gaps[mid]) / 2;
            } else {
                minSpacing = spacing.getSeconds();
                medianSpacing = spacing.getSeconds();
            }
            double span = TimeMapper.seconds(Duration.between(start, end));
            int width = (int) (span * placementWidth / (minSpacing / 2.0));
            width = Math.max(width, placementWidth + 1);
            int dataSpacing = (int) (width / span * medianSpacing);
            return new TimeAxis(width, dataSpacing);
        }
    }
}
