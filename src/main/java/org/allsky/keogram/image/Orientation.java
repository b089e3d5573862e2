package org.allsky.keogram.image;

/**
 * Orientation convention of an image that has been aligned with north, i.e.
 * the order in which the compass points appear going anticlockwise around the
 * image.
 */
public enum Orientation {

    NESW {
        @Override
        public double rotationFor(double angle, double camRot) {
            return angle - camRot;
        }
    },
    NWSE {
        @Override
        public double rotationFor(double angle, double camRot) {
            return camRot - angle;
        }
    };

    /**
     * The anticlockwise rotation, in degrees, which brings the given azimuth
     * to run from the top to the bottom of the image.
     *
     * @param angle Azimuth from geographic north
     * @param camRot Rotation of the camera relative to north
     * @return The rotation to apply
     */
    public abstract double rotationFor(double angle, double camRot);
}
