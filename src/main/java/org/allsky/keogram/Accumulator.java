package org.allsky.keogram;

import java.time.Instant;
import java.util.BitSet;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.allsky.keogram.image.PixelBuffer;
import org.allsky.keogram.projection.TimeMapper;
import org.allsky.keogram.strip.Strip;

/**
 * Places strips into a keogram buffer at the column given by their capture
 * time. The buffer is mutated in place, so an accumulator must only be used
 * by one thread.
 */
public class Accumulator {

    private static final Logger LOG = Logger.getLogger(Accumulator.class.getName());

    private final PixelBuffer buffer;
    private final TimeMapper timeMapper;
    private final KeoType keoType;
    private final BitSet written = new BitSet();

    public Accumulator(PixelBuffer buffer, TimeMapper timeMapper, KeoType keoType) {
        if (buffer.getWidth() != timeMapper.getWidth()) {
            throw new IllegalArgumentException("Buffer width " + buffer.getWidth() + " does not match time axis width " + timeMapper.getWidth());
        }
        this.buffer = buffer;
        this.timeMapper = timeMapper;
        this.keoType = keoType;
    }

    /**
     * Write a strip into the buffer.
     *
     * @param strip The strip, which must have the height and mode of the
     * buffer
     * @param captureTime The capture time of the image the strip was cut from
     * @return The un-rounded column of the capture time
     */
    public double putStrip(Strip strip, Instant captureTime) {
        double x = timeMapper.timeToPixel(captureTime);
        PixelBuffer columns = keoType == KeoType.AVERAGE ? strip.columnMean() : strip.getPixels();
        int count = columns.getWidth();
        int first = (int) Math.round(x) - count / 2;

        int from = Math.max(0, first);
        int to = Math.min(buffer.getWidth(), first + count);
        if (to <= from) {
            LOG.log(Level.WARNING, "Strip for {0} falls outside the keogram", captureTime);
            return x;
        }
        if (written.get(from, to).cardinality() > 0) {
            LOG.log(Level.WARNING, "Strip for {0} overlaps data already in columns {1}-{2}", new Object[]{captureTime, from, to - 1});
        }
        buffer.copyColumns(columns, 0, first, count);
        written.set(from, to);
        return x;
    }

    public PixelBuffer getBuffer() {
        return buffer;
    }

    public TimeMapper getTimeMapper() {
        return timeMapper;
    }
}
