package org.allsky.keogram;

import java.time.Instant;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.allsky.keogram.projection.FovRange;

/**
 * Parameters controlling how a keogram is built. Unset optional values (field
 * of view, start and end time) are derived from the images.
 */
public class KeogramBuildParam {

    private static final Logger LOG = Logger.getLogger(KeogramBuildParam.class.getName());

    public static final int DEFAULT_STRIP_WIDTH = 5;

    private double angle;
    private int stripWidth = DEFAULT_STRIP_WIDTH;
    private DataSpacing dataSpacing = DataSpacing.AUTO;
    private KeoType keoType = KeoType.COPY_PASTE;
    private FovRange fovRange;
    private Instant start;
    private Instant end;
    private int parallelism = Integer.getInteger("org.allsky.keogram.parallelism", Runtime.getRuntime().availableProcessors());

    public KeogramBuildParam() {
    }

    public KeogramBuildParam(double angle) {
        this.angle = angle;
    }

    /**
     * Azimuth, in degrees from geographic north, along which strips are cut.
     *
     * @return The angle
     */
    public double getAngle() {
        return angle;
    }

    public void setAngle(double angle) {
        this.angle = angle;
    }

    public int getStripWidth() {
        return stripWidth;
    }

    /**
     * Set the width of the strip cut from each image. Strips are centred on a
     * column, so even widths are increased by one.
     *
     * @param stripWidth The width in pixels
     */
    public void setStripWidth(int stripWidth) {
        if (stripWidth <= 0) {
            throw new ConfigurationException("Strip width must be positive, got " + stripWidth);
        }
        if (stripWidth % 2 == 0) {
            LOG.log(Level.WARNING, "Strip width {0} is even, using {1}", new Object[]{stripWidth, stripWidth + 1});
            stripWidth++;
        }
        this.stripWidth = stripWidth;
    }

    public DataSpacing getDataSpacing() {
        return dataSpacing;
    }

    public void setDataSpacing(DataSpacing dataSpacing) {
        this.dataSpacing = Objects.requireNonNull(dataSpacing);
    }

    public KeoType getKeoType() {
        return keoType;
    }

    public void setKeoType(KeoType keoType) {
        this.keoType = Objects.requireNonNull(keoType);
    }

    public void setKeoType(String name) {
        setKeoType(KeoType.fromName(name));
    }

    /**
     * @return The requested field of view, or null to use that of the images
     */
    public FovRange getFovRange() {
        return fovRange;
    }

    public void setFovRange(FovRange fovRange) {
        this.fovRange = fovRange;
    }

    public Instant getStart() {
        return start;
    }

    public void setStart(Instant start) {
        this.start = start;
    }

    public Instant getEnd() {
        return end;
    }

    public void setEnd(Instant end) {
        this.end = end;
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        if (parallelism <= 0) {
            throw new ConfigurationException("Parallelism must be positive, got " + parallelism);
        }
        this.parallelism = parallelism;
    }

    @Override
    public String toString() {
        return "KeogramBuildParam{" + "angle=" + angle + ", stripWidth=" + stripWidth + ", dataSpacing=" + dataSpacing + ", keoType=" + keoType + ", fovRange=" + fovRange + ", start=" + start + ", end=" + end + '}';
    }
}
