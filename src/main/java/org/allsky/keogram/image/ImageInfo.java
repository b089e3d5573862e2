package org.allsky.keogram.image;

import java.time.Instant;
import java.util.Objects;
import org.allsky.keogram.cmap.ColourTable;
import org.allsky.keogram.projection.LensProjection;

/**
 * Metadata describing one all-sky image. Instances are created through
 * {@link Builder}, which validates the values once so that the keogram code
 * never has to re-check them.
 */
public final class ImageInfo {

    private final Instant captureTime;
    private final Mode mode;
    private final double fovAngle;
    private final LensProjection lensProjection;
    private final int radius;
    private final int centreX;
    private final int centreY;
    private final double camRot;
    private final Orientation orientation;
    private final boolean centred;
    private final boolean masked;
    private final Double calibrationFactor;
    private final ColourTable colourTable;
    private final String wavelength;

    private ImageInfo(Builder builder) {
        this.captureTime = Objects.requireNonNull(builder.captureTime, "captureTime");
        this.mode = Objects.requireNonNull(builder.mode, "mode");
        this.lensProjection = Objects.requireNonNull(builder.lensProjection, "lensProjection");
        if (!(builder.fovAngle > 0 && builder.fovAngle <= 90)) {
            throw new IllegalArgumentException("Field of view angle must be in (0, 90], got " + builder.fovAngle);
        }
        if (builder.radius <= 0) {
            throw new IllegalArgumentException("Radius must be positive, got " + builder.radius);
        }
        this.fovAngle = builder.fovAngle;
        this.radius = builder.radius;
        this.centreX = builder.centreX;
        this.centreY = builder.centreY;
        this.camRot = builder.camRot;
        this.orientation = builder.orientation;
        this.centred = builder.centred;
        this.masked = builder.masked;
        this.calibrationFactor = builder.calibrationFactor;
        this.colourTable = builder.colourTable;
        this.wavelength = builder.wavelength;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.captureTime = captureTime;
        b.mode = mode;
        b.fovAngle = fovAngle;
        b.lensProjection = lensProjection;
        b.radius = radius;
        b.centreX = centreX;
        b.centreY = centreY;
        b.camRot = camRot;
        b.orientation = orientation;
        b.centred = centred;
        b.masked = masked;
        b.calibrationFactor = calibrationFactor;
        b.colourTable = colourTable;
        b.wavelength = wavelength;
        return b;
    }

    public Instant getCaptureTime() {
        return captureTime;
    }

    public Mode getMode() {
        return mode;
    }

    /**
     * Half angle of the field of view, in degrees from the zenith.
     *
     * @return The field of view angle
     */
    public double getFovAngle() {
        return fovAngle;
    }

    public LensProjection getLensProjection() {
        return lensProjection;
    }

    public int getRadius() {
        return radius;
    }

    public int getCentreX() {
        return centreX;
    }

    public int getCentreY() {
        return centreY;
    }

    public double getCamRot() {
        return camRot;
    }

    /**
     * The orientation convention of the image, or null if the image has not
     * been aligned with north.
     *
     * @return The orientation
     */
    public Orientation getOrientation() {
        return orientation;
    }

    public boolean isCentred() {
        return centred;
    }

    public boolean isMasked() {
        return masked;
    }

    public Double getCalibrationFactor() {
        return calibrationFactor;
    }

    public ColourTable getColourTable() {
        return colourTable;
    }

    public String getWavelength() {
        return wavelength;
    }

    @Override
    public String toString() {
        return "ImageInfo{" + "captureTime=" + captureTime + ", mode=" + mode + ", fovAngle=" + fovAngle + ", lensProjection=" + lensProjection + ", radius=" + radius + '}';
    }

    public static class Builder {

        private Instant captureTime;
        private Mode mode;
        private double fovAngle = 90;
        private LensProjection lensProjection = LensProjection.EQUIDISTANT;
        private int radius;
        private int centreX;
        private int centreY;
        private double camRot;
        private Orientation orientation;
        private boolean centred;
        private boolean masked;
        private Double calibrationFactor;
        private ColourTable colourTable;
        private String wavelength;

        private Builder() {
        }

        public Builder captureTime(Instant captureTime) {
            this.captureTime = captureTime;
            return this;
        }

        public Builder mode(Mode mode) {
            this.mode = mode;
            return this;
        }

        public Builder fovAngle(double fovAngle) {
            this.fovAngle = fovAngle;
            return this;
        }

        public Builder lensProjection(LensProjection lensProjection) {
            this.lensProjection = lensProjection;
            return this;
        }

        public Builder radius(int radius) {
            this.radius = radius;
            return this;
        }

        public Builder centre(int centreX, int centreY) {
            this.centreX = centreX;
            this.centreY = centreY;
            return this;
        }

        public Builder camRot(double camRot) {
            this.camRot = camRot;
            return this;
        }

        public Builder orientation(Orientation orientation) {
            this.orientation = orientation;
            return this;
        }

        public Builder centred(boolean centred) {
            this.centred = centred;
            return this;
        }

        public Builder masked(boolean masked) {
            this.masked = masked;
            return this;
        }

        public Builder calibrationFactor(Double calibrationFactor) {
            this.calibrationFactor = calibrationFactor;
            return this;
        }

        public Builder colourTable(ColourTable colourTable) {
            this.colourTable = colourTable;
            return this;
        }

        public Builder wavelength(String wavelength) {
            this.wavelength = wavelength;
            return this;
        }

        public ImageInfo build() {
            return new ImageInfo(this);
        }
    }
}
