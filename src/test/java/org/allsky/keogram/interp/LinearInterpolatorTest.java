package org.allsky.keogram.interp;

import org.allsky.keogram.image.Mode;
import org.allsky.keogram.image.PixelBuffer;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import org.junit.Test;

public class LinearInterpolatorTest {

    private static PixelBuffer columns(Mode mode, int width, int height, int[] xs, int[] values) {
        PixelBuffer buffer = new PixelBuffer(mode, width, height);
        for (int i = 0; i < xs.length; i++) {
            for (int y = 0; y < height; y++) {
                for (int c = 0; c < buffer.getChannels(); c++) {
                    buffer.set(xs[i], y, c, values[i]);
                }
            }
        }
        return buffer;
    }

    @Test
    public void testFillsOnlyBridgeableGaps() {
        PixelBuffer buffer = columns(Mode.I, 250, 4, new int[]{10, 50, 200}, new int[]{100, 200, 300});
        new LinearInterpolator().interpolate(buffer, new int[]{10, 50, 200}, 1, 60);
        for (int x = 11; x < 50; x++) {
            assertTrue("column " + x, buffer.get(x, 2, 0) > 0);
        }
        assertEquals(150, buffer.get(30, 0, 0));
        assertEquals(102, buffer.get(11, 3, 0));
        for (int x = 51; x < 200; x++) {
            assertEquals("column " + x, 0, buffer.get(x, 2, 0));
        }
    }

    @Test
    public void testStripWidthIsRespected() {
        // Strips of width 5 centred on 10 and 30: columns 12 and 28 are the end points
        PixelBuffer buffer = columns(Mode.L, 40, 2, new int[]{12, 28}, new int[]{0, 160});
        new LinearInterpolator().interpolate(buffer, new int[]{10, 30}, 5, 40);
        assertEquals(80, buffer.get(20, 1, 0));
        assertEquals(0, buffer.get(11, 1, 0));
        assertEquals(0, buffer.get(29, 1, 0));
    }

    @Test
    public void testAdjacentStripsAreLeftAlone() {
        PixelBuffer buffer = columns(Mode.L, 40, 2, new int[]{10, 15}, new int[]{50, 100});
        PixelBuffer before = buffer.copy();
        new LinearInterpolator().interpolate(buffer, new int[]{10, 15}, 5, 40);
        assertEquals(before, buffer);
    }

    @Test
    public void testChannelsInterpolateIndependently() {
        PixelBuffer buffer = new PixelBuffer(Mode.RGB, 20, 1);
        buffer.setRGB(2, 0, 0x000010);
        buffer.setRGB(12, 0, 0xff0020);
        new LinearInterpolator().interpolate(buffer, new int[]{2, 12}, 1, 20);
        assertEquals(127, buffer.get(7, 0, 0));
        assertEquals(0, buffer.get(7, 0, 1));
        assertEquals(0x18, buffer.get(7, 0, 2));
    }
}
