package org.allsky.keogram;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import org.allsky.keogram.cmap.ColourTable;
import org.allsky.keogram.image.AllskyImage;
import org.allsky.keogram.image.ImageList;
import org.allsky.keogram.image.Mode;
import org.allsky.keogram.image.PixelBuffer;
import org.allsky.keogram.projection.FovRange;
import org.allsky.keogram.projection.LensProjection;
import org.junit.BeforeClass;
import org.junit.Test;

public class KeogramTest {

    private static final Instant T0 = SyntheticImages.T0;
    private static Keogram keogram;

    @BeforeClass
    public static void build() {
        keogram = new KeogramBuilder(0).build(SyntheticImages.series(T0, 20, 60));
    }

    private static Keogram uniform(Mode mode, int value) {
        PixelBuffer data = new PixelBuffer(mode, 20, 10);
        for (int x = 0; x < 20; x++) {
            for (int y = 0; y < 10; y++) {
                for (int c = 0; c < data.getChannels(); c++) {
                    data.set(x, y, c, value);
                }
            }
        }
        return new Keogram(data, T0, T0.plusSeconds(60), 0, FovRange.FULL_SKY, LensProjection.EQUIDISTANT, 5,
                KeoType.COPY_PASTE, new double[]{2, 17}, 15, null, null);
    }

    @Test
    public void testConstructorCopiesData() {
        PixelBuffer data = new PixelBuffer(Mode.L, 20, 10);
        data.set(3, 4, 0, 50);
        Keogram copied = new Keogram(data, T0, T0.plusSeconds(60), 0, FovRange.FULL_SKY, LensProjection.EQUIDISTANT, 5,
                KeoType.COPY_PASTE, new double[]{3}, 15, null, null);
        data.set(3, 4, 0, 99);
        assertEquals(50, copied.getData().get(3, 4, 0));
    }

    @Test
    public void testAccessorsOutOfRange() {
        assertNull(keogram.angle2pix(-1));
        assertNull(keogram.angle2pix(181));
        assertNull(keogram.pix2angle(keogram.getHeight()));
        assertNull(keogram.time2pix(T0.minusSeconds(1)));
        assertNull(keogram.pix2time(-1));
        assertEquals(0, keogram.angle2pix(0), 1e-9);
        assertEquals(keogram.getHeight() - 1, keogram.angle2pix(180), 1e-9);
        assertEquals(90, keogram.pix2angle(keogram.angle2pix(90)), 1e-9);
        assertEquals(2, keogram.time2pix(T0), 1e-9);
    }

    @Test
    public void testRollForward() {
        Keogram hour = new KeogramBuilder(0).build(SyntheticImages.series(T0, 61, 60));
        assertEquals(600, hour.getWidth());
        AllskyImage late = SyntheticImages.image(T0.plusSeconds(3700), 200);
        Keogram rolled = hour.roll(new ImageList(Collections.singletonList(late)));

        assertEquals(T0.plusSeconds(100), rolled.getStartTime());
        assertEquals(T0.plusSeconds(3700), rolled.getEndTime());
        assertEquals(hour.getWidth(), rolled.getWidth());
        assertEquals(60, rolled.getDataPoints().length);
        assertEquals(200 + 20, rolled.getData().get(rolled.getWidth() - 1, 20, 0));

        // Surviving data keeps its pixels, shifted by the roll
        double[] before = hour.getDataPoints();
        double[] after = rolled.getDataPoints();
        int shift = (int) Math.round(before[2] - after[0]);
        assertEquals(17, shift);
        int x = (int) Math.round(after[0]);
        assertEquals(hour.getData().get(x + shift, 7, 0), rolled.getData().get(x, 7, 0));
    }

    @Test
    public void testRollBackward() {
        AllskyImage early = SyntheticImages.image(T0.minusSeconds(100), 30);
        Keogram rolled = keogram.roll(new ImageList(Collections.singletonList(early)));
        assertEquals(T0.minusSeconds(100), rolled.getStartTime());
        assertEquals(keogram.getEndTime().minusSeconds(100), rolled.getEndTime());
        assertEquals(30 + 20, rolled.getData().get(0, 20, 0));
    }

    @Test
    public void testRollNothing() {
        Keogram rolled = keogram.roll(new ImageList(Collections.<AllskyImage>emptyList()));
        assertEquals(keogram, rolled);
    }

    @Test(expected = RangeException.class)
    public void testRollBothWays() {
        List<AllskyImage> images = Arrays.asList(
                SyntheticImages.image(T0.minusSeconds(100), 30),
                SyntheticImages.image(keogram.getEndTime().plusSeconds(100), 30));
        keogram.roll(new ImageList(images));
    }

    @Test
    public void testZoomFovIsIdempotent() {
        FovRange range = new FovRange(30, 150);
        Keogram once = keogram.zoomFov(range);
        Keogram twice = once.zoomFov(range);
        assertEquals(once, twice);
        assertEquals(range, once.getFovRange());
        assertTrue(once.getHeight() < keogram.getHeight());
        assertEquals(keogram.getWidth(), once.getWidth());
        assertEquals(keogram.getDataPoints().length, once.getDataPoints().length);
        assertEquals(keogram, keogram.zoomFov(FovRange.FULL_SKY));
    }

    @Test(expected = RangeException.class)
    public void testZoomFovOutside() {
        keogram.zoomFov(new FovRange(30, 150)).zoomFov(new FovRange(20, 160));
    }

    @Test
    public void testZoomTime() {
        Keogram zoomed = keogram.zoomTime(T0.plusSeconds(290), T0.plusSeconds(610));
        assertEquals(T0.plusSeconds(290), zoomed.getStartTime());
        assertEquals(T0.plusSeconds(610), zoomed.getEndTime());
        assertEquals(57, zoomed.getWidth());
        assertEquals(keogram.getHeight(), zoomed.getHeight());
        assertEquals(6, zoomed.getDataPoints().length);
        assertEquals(keogram.getData().get(49, 5, 0), zoomed.getData().get(2, 5, 0));
    }

    @Test
    public void testZoomTimeIsClamped() {
        Keogram zoomed = keogram.zoomTime(T0.minusSeconds(600), T0.plusSeconds(610));
        assertEquals(T0, zoomed.getStartTime());
        assertEquals(11, zoomed.getDataPoints().length);
    }

    @Test(expected = RangeException.class)
    public void testZoomTimeOutside() {
        keogram.zoomTime(T0.plusSeconds(5000), T0.plusSeconds(6000));
    }

    @Test
    public void testIntensitiesAtAngle() {
        HorizontalSlice slice = keogram.getIntensitiesAt(90.0);
        assertNotNull(slice);
        assertEquals(keogram.getWidth(), slice.size());
        assertEquals(keogram.getWidth(), slice.getTimes().size());
        for (double intensity : slice.getRawIntensities()) {
            assertTrue(intensity > 0);
        }
        assertNull(keogram.getIntensitiesAt(-10.0));
    }

    @Test
    public void testIntensitiesAtTime() {
        VerticalSlice slice = keogram.getIntensitiesAt(T0);
        assertNotNull(slice);
        assertEquals(keogram.getHeight(), slice.size());
        assertEquals(15.0, slice.getRawIntensities()[5], 1e-9);
        assertEquals(0.0, slice.getAngles().get(0), 1e-9);
        assertNull(keogram.getIntensitiesAt(T0.minusSeconds(3600)));
    }

    @Test
    public void testIntensitiesIgnoreMissingData() {
        PixelBuffer data = new PixelBuffer(Mode.I, 20, 10);
        data.set(10, 4, 0, 100);
        Keogram sparse = new Keogram(data, T0, T0.plusSeconds(60), 0, FovRange.FULL_SKY, LensProjection.EQUIDISTANT, 5,
                KeoType.COPY_PASTE, new double[]{10}, 15, null, null);
        VerticalSlice slice = sparse.getIntensitiesAt(sparse.pix2time(10), 5);
        assertEquals(100.0, slice.getRawIntensities()[4], 1e-9);
        assertEquals(0.0, slice.getRawIntensities()[3], 1e-9);
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testIntensitiesOfRGB() {
        uniform(Mode.RGB, 10).getIntensitiesAt(90.0);
    }

    @Test
    public void testAbsoluteCalibration() {
        Keogram calibrated = uniform(Mode.L, 50).absoluteCalibration(2.0, 5.0);
        assertEquals(1e-4, calibrated.getCalibrationFactor(), 1e-12);
        VerticalSlice slice = calibrated.getIntensitiesAt(T0.plusSeconds(30));
        assertTrue(slice.isCalibrated());
        assertEquals(50 * 1e-4, slice.getCalibratedIntensities()[3], 1e-12);
    }

    @Test(expected = CompatibilityException.class)
    public void testCalibrateRGB() {
        uniform(Mode.RGB, 10).absoluteCalibration(2.0, 5.0);
    }

    @Test(expected = CompatibilityException.class)
    public void testColourTableOnRGB() {
        uniform(Mode.RGB, 10).applyColourTable(new ColourTable(new int[]{0, 0xffffff}));
    }

    @Test
    public void testApplyColourTable() {
        ColourTable table = new ColourTable(new int[]{0, 0x808080, 0xffffff});
        Keogram coloured = uniform(Mode.L, 1).applyColourTable(table);
        assertEquals(table, coloured.getColourTable());
        assertEquals(uniform(Mode.L, 1).getData(), coloured.getData());
    }

    @Test
    public void testHistogram() {
        long[] histogram = keogram.histogram();
        assertEquals(256, histogram.length);
        long total = 0;
        for (long count : histogram) {
            total += count;
        }
        assertEquals((long) keogram.getWidth() * keogram.getHeight(), total);
        assertEquals(65536, uniform(Mode.I, 70000).histogram().length);
        assertEquals(200, uniform(Mode.I, 70000).histogram()[65535]);
    }

    @Test
    public void testMedianFilter() {
        PixelBuffer data = uniform(Mode.L, 7).getData();
        data.set(5, 5, 0, 255);
        Keogram spiky = new Keogram(data, T0, T0.plusSeconds(60), 0, FovRange.FULL_SKY, LensProjection.EQUIDISTANT, 5,
                KeoType.COPY_PASTE, new double[]{2, 17}, 15, null, null);
        Keogram filtered = spiky.medianFilter(3);
        assertEquals(7, filtered.getData().get(5, 5, 0));
        assertEquals(uniform(Mode.L, 7), filtered);
        assertEquals(filtered, spiky.medianFilter(2));
    }

    @Test
    public void testCombine() {
        ImageList images = SyntheticImages.series(T0, 20, 60);
        List<AllskyImage> first = new ArrayList<>();
        List<AllskyImage> second = new ArrayList<>();
        for (int i = 0; i < images.size(); i++) {
            (i < 10 ? first : second).add(images.getImage(i));
        }
        KeogramBuilder builder = new KeogramBuilder(0);
        Keogram combined = KeogramCombiner.combine(Arrays.asList(
                builder.build(new ImageList(first)), builder.build(new ImageList(second))), DataSpacing.AUTO);
        assertEquals(20, combined.getDataPoints().length);
        assertEquals(keogram.getHeight(), combined.getHeight());
        assertEquals(T0.toEpochMilli(), combined.getStartTime().toEpochMilli(), 1);
        assertEquals(keogram.getEndTime().toEpochMilli(), combined.getEndTime().toEpochMilli(), 1);
    }

    @Test(expected = IncompatibleKeogramsException.class)
    public void testCombineDifferentAngles() {
        Keogram other = new KeogramBuilder(45).build(SyntheticImages.series(T0.plusSeconds(3600), 5, 60));
        KeogramCombiner.combine(Arrays.asList(keogram, other), DataSpacing.AUTO);
    }
}
