package org.allsky.keogram;

/**
 * The expected interval between images. Either given explicitly or estimated
 * from the capture times of the images being combined.
 */
public final class DataSpacing {

    public static final DataSpacing AUTO = new DataSpacing(Double.NaN);

    private final double seconds;

    private DataSpacing(double seconds) {
        this.seconds = seconds;
    }

    public static DataSpacing ofSeconds(double seconds) {
        if (!(seconds > 0)) {
            throw new ConfigurationException("Data spacing must be positive, got " + seconds);
        }
        return new DataSpacing(seconds);
    }

    public boolean isAuto() {
        return Double.isNaN(seconds);
    }

    /**
     * @return The spacing in seconds, NaN for {@link #AUTO}
     */
    public double getSeconds() {
        return seconds;
    }

    @Override
    public String toString() {
        return isAuto() ? "auto" : seconds + "s";
    }

    @Override
    public int hashCode() {
        return Double.hashCode(seconds);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return Double.compare(this.seconds, ((DataSpacing) obj).seconds) == 0;
    }
}
