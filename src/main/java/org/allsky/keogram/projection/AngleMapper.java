package org.allsky.keogram.projection;

/**
 * Converts between angles and pixel positions along an axis whose first pixel
 * corresponds to the lower bound of a field of view range and whose last pixel
 * corresponds to the upper bound. Pixel positions are fractional. No range
 * checking is done here, callers decide what to do with positions outside the
 * axis.
 */
public final class AngleMapper {

    private final int size;
    private final FovRange fov;
    private final LensProjection projection;
    private final double focalLength;
    private final double zenithPixel;

    AngleMapper(int size, FovRange fov, LensProjection projection) {
        if (size < 2) {
            throw new IllegalArgumentException("Axis must be at least 2 pixels, got " + size);
        }
        this.size = size;
        this.fov = fov;
        this.projection = projection;
        double lower = projection.displacement(fov.getMin());
        double upper = projection.displacement(fov.getMax());
        focalLength = (size - 1) / (upper - lower);
        zenithPixel = -focalLength * lower;
    }

    public double angleToPixel(double angle) {
        return zenithPixel + focalLength * projection.displacement(angle);
    }

    public double pixelToAngle(double pixel) {
        return projection.angleAt((pixel - zenithPixel) / focalLength);
    }

    public double getFocalLength() {
        return focalLength;
    }

    /**
     * The (possibly off axis) pixel position of the zenith.
     *
     * @return The zenith position
     */
    public double getZenithPixel() {
        return zenithPixel;
    }

    public int getSize() {
        return size;
    }

    public FovRange getFov() {
        return fov;
    }

    public LensProjection getProjection() {
        return projection;
    }
}
