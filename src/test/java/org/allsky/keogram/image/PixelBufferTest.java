package org.allsky.keogram.image;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import org.allsky.keogram.ConfigurationException;
import org.junit.Test;

public class PixelBufferTest {

    @Test
    public void testClamping() {
        PixelBuffer buffer = new PixelBuffer(Mode.L, 2, 2);
        buffer.set(0, 0, 0, 300);
        buffer.set(1, 1, 0, -4);
        assertEquals(255, buffer.get(0, 0, 0));
        assertEquals(0, buffer.get(1, 1, 0));

        PixelBuffer intensity = new PixelBuffer(Mode.I, 1, 1);
        intensity.set(0, 0, 0, 70000);
        assertEquals(70000, intensity.get(0, 0, 0));
    }

    @Test(expected = ConfigurationException.class)
    public void testSizeOverflow() {
        new PixelBuffer(Mode.RGB, 30000, 30000);
    }

    @Test
    public void testRGB() {
        PixelBuffer buffer = new PixelBuffer(Mode.RGB, 3, 3);
        buffer.setRGB(1, 2, 0x102030);
        assertEquals(0x102030, buffer.getRGB(1, 2));
        assertEquals(0x20, buffer.get(1, 2, 1));
        assertTrue(buffer.isBackground(0, 0));
        assertFalse(buffer.isBackground(1, 2));
    }

    @Test
    public void testCopyColumnsSkipsOutside() {
        PixelBuffer source = new PixelBuffer(Mode.L, 4, 2);
        for (int x = 0; x < 4; x++) {
            source.set(x, 1, 0, x + 1);
        }
        PixelBuffer target = new PixelBuffer(Mode.L, 5, 2);
        target.copyColumns(source, 0, -2, 4);
        assertEquals(3, target.get(0, 1, 0));
        assertEquals(4, target.get(1, 1, 0));
        assertEquals(0, target.get(2, 1, 0));

        target.copyColumns(source, 0, 3, 4);
        assertEquals(1, target.get(3, 1, 0));
        assertEquals(2, target.get(4, 1, 0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCopyColumnsOtherHeight() {
        new PixelBuffer(Mode.L, 4, 3).copyColumns(new PixelBuffer(Mode.L, 4, 2), 0, 0, 1);
    }

    @Test
    public void testCrop() {
        PixelBuffer buffer = new PixelBuffer(Mode.I, 5, 5);
        buffer.set(3, 2, 0, 42);
        PixelBuffer cropped = buffer.crop(2, 1, 3, 3);
        assertEquals(3, cropped.getWidth());
        assertEquals(42, cropped.get(1, 1, 0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCropOutside() {
        new PixelBuffer(Mode.I, 5, 5).crop(3, 0, 3, 5);
    }

    @Test
    public void testCopyIsIndependent() {
        PixelBuffer buffer = new PixelBuffer(Mode.L, 2, 2);
        PixelBuffer copy = buffer.copy();
        assertEquals(buffer, copy);
        copy.set(0, 0, 0, 9);
        assertNotEquals(buffer, copy);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testWrongDataLength() {
        new PixelBuffer(Mode.RGB, 2, 2, new int[4]);
    }
}
