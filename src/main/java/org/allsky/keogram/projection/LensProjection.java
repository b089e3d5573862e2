package org.allsky.keogram.projection;

import org.allsky.keogram.UnsupportedProjectionException;

/**
 * The angle to pixel distance law of a fisheye lens. Each projection is
 * described by its displacement function: the distance from the zenith, for
 * unit focal length, of a ray at a given angle. Angles are measured in degrees
 * across the sky, so the zenith is at 90 degrees and the two horizons at 0 and
 * 180 degrees. Displacements below the zenith are negative.
 */
public enum LensProjection {

    EQUIDISTANT("equidistant") {
        @Override
        public double displacement(double angle) {
            return Math.toRadians(angle - 90.0);
        }

        @Override
        public double angleAt(double displacement) {
            return 90.0 + Math.toDegrees(displacement);
        }
    },
    EQUISOLIDANGLE("equisolidangle") {
        @Override
        public double displacement(double angle) {
            double fromZenith = Math.toRadians(Math.abs(angle - 90.0));
            return Math.signum(angle - 90.0) * 2.0 * Math.sin(fromZenith / 2.0);
        }

        @Override
        public double angleAt(double displacement) {
            double ratio = Math.min(1.0, Math.abs(displacement) / 2.0);
            return 90.0 + Math.signum(displacement) * Math.toDegrees(2.0 * Math.asin(ratio));
        }
    };

    private final String projectionName;

    LensProjection(String name) {
        this.projectionName = name;
    }

    public abstract double displacement(double angle);

    public abstract double angleAt(double displacement);

    public String getProjectionName() {
        return projectionName;
    }

    /**
     * Create a mapper between angles and pixels for an axis of the given size.
     *
     * @param size Number of pixels spanned by the field of view
     * @param fov The field of view
     * @return The mapper
     */
    public AngleMapper mapper(int size, FovRange fov) {
        return new AngleMapper(size, fov, this);
    }

    public static LensProjection fromName(String name) {
        for (LensProjection projection : values()) {
            if (projection.projectionName.equals(name)) {
                return projection;
            }
        }
        throw new UnsupportedProjectionException(name);
    }
}
