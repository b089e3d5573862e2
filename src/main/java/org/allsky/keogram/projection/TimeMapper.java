package org.allsky.keogram.projection;

import java.time.Duration;
import java.time.Instant;

/**
 * Linear mapping between instants and pixel columns of a keogram. The first
 * and last half strip of columns are kept free so that strips placed at the
 * start and end time fit fully inside the keogram.
 */
public final class TimeMapper {

    private static final double NANOS_PER_SECOND = 1e9;

    private final Instant start;
    private final Instant end;
    private final int width;
    private final int stripWidth;
    private final int halfStrip;
    private final double pixelsPerSecond;

    public TimeMapper(Instant start, Instant end, int width, int stripWidth) {
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("Start time " + start + " must be before end time " + end);
        }
        if (width <= stripWidth) {
            throw new IllegalArgumentException("Width " + width + " must exceed strip width " + stripWidth);
        }
        this.start = start;
        this.end = end;
        this.width = width;
        this.stripWidth = stripWidth;
        this.halfStrip = stripWidth / 2;
        this.pixelsPerSecond = (width - stripWidth) / seconds(Duration.between(start, end));
    }

    public double timeToPixel(Instant time) {
        return seconds(Duration.between(start, time)) * pixelsPerSecond + halfStrip;
    }

    public Instant pixelToTime(double pixel) {
        double offset = (pixel - halfStrip) / pixelsPerSecond;
        return start.plusNanos(Math.round(offset * NANOS_PER_SECOND));
    }

    /**
     * Number of pixels spanned by a duration.
     *
     * @param duration The duration
     * @return Fractional pixel count
     */
    public double durationToPixels(Duration duration) {
        return seconds(duration) * pixelsPerSecond;
    }

    public static double seconds(Duration duration) {
        return duration.getSeconds() + duration.getNano() / NANOS_PER_SECOND;
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

    public int getStripWidth() {
        return stripWidth;
    }
}
