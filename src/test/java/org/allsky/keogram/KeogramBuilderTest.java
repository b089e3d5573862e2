package org.allsky.keogram;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.allsky.keogram.image.AllskyImage;
import org.allsky.keogram.image.ImageInfo;
import org.allsky.keogram.image.ImageList;
import org.allsky.keogram.image.ImageSource;
import org.allsky.keogram.image.Mode;
import org.allsky.keogram.image.PixelBuffer;
import org.allsky.keogram.projection.AngleMapper;
import org.allsky.keogram.projection.FovRange;
import org.allsky.keogram.projection.LensProjection;
import org.junit.Test;

public class KeogramBuilderTest {

    @Test
    public void testSequentialBuild() {
        ImageList images = SyntheticImages.series(SyntheticImages.T0, 20, 60);
        Keogram keogram = new KeogramBuilder(0).build(images);

        assertEquals(190, keogram.getWidth());
        assertEquals(40, keogram.getHeight());
        assertEquals(Mode.L, keogram.getMode());
        assertEquals(SyntheticImages.T0, keogram.getStartTime());
        assertEquals(SyntheticImages.T0.plusSeconds(19 * 60), keogram.getEndTime());
        assertEquals(FovRange.FULL_SKY, keogram.getFovRange());
        assertEquals(20, keogram.getDataPoints().length);
        assertEquals(2.0, keogram.getDataPoints()[0], 1e-9);
        assertEquals(187.0, keogram.getDataPoints()[19], 1e-9);

        // First strip is written unchanged, gaps between strips are interpolated
        PixelBuffer data = keogram.getData();
        assertEquals(10 + 5, data.get(0, 5, 0));
        assertEquals(10 + 5, data.get(4, 5, 0));
        for (int x = 0; x < keogram.getWidth(); x++) {
            assertTrue("column " + x, data.get(x, 10, 0) > 0);
        }
    }

    @Test
    public void testParallelMatchesSequential() {
        ImageList images = SyntheticImages.series(SyntheticImages.T0, 20, 60);
        KeogramBuilder builder = new KeogramBuilder(0);
        Keogram sequential = builder.build(images);
        Keogram parallel = builder.buildParallel(images, 4);
        assertEquals(sequential, parallel);
        assertEquals(sequential, builder.buildParallel(images));
    }

    @Test
    public void testAverageParallelMatchesSequential() {
        ImageList images = SyntheticImages.series(SyntheticImages.T0, 20, 60);
        KeogramBuildParam param = new KeogramBuildParam(0);
        param.setKeoType(KeoType.AVERAGE);
        param.setStripWidth(3);
        KeogramBuilder builder = new KeogramBuilder(param);
        Keogram sequential = builder.build(images);
        assertEquals(5, sequential.getStripWidth());
        assertEquals(sequential, builder.buildParallel(images, 3));
    }

    @Test(expected = EmptyDatasetException.class)
    public void testEmptyDataset() {
        new KeogramBuilder(0).build(new ImageList(Collections.<AllskyImage>emptyList()));
    }

    @Test(expected = DataInsufficientException.class)
    public void testSingleImageNeedsSpacing() {
        new KeogramBuilder(0).build(SyntheticImages.series(SyntheticImages.T0, 1, 60));
    }

    @Test
    public void testSingleImageWithSpacing() {
        KeogramBuildParam param = new KeogramBuildParam(0);
        param.setDataSpacing(DataSpacing.ofSeconds(60));
        Keogram keogram = new KeogramBuilder(param).build(SyntheticImages.series(SyntheticImages.T0, 1, 60));
        assertEquals(SyntheticImages.T0.plusSeconds(3600), keogram.getEndTime());
        assertEquals(1, keogram.getDataPoints().length);
    }

    @Test(expected = NoDataInRangeException.class)
    public void testNoDataInRange() {
        KeogramBuildParam param = new KeogramBuildParam(0);
        param.setStart(SyntheticImages.T0.plusSeconds(7200));
        new KeogramBuilder(param).build(SyntheticImages.series(SyntheticImages.T0, 10, 60));
    }

    @Test(expected = RangeException.class)
    public void testStartAfterEnd() {
        KeogramBuildParam param = new KeogramBuildParam(0);
        param.setStart(SyntheticImages.T0.plusSeconds(300));
        param.setEnd(SyntheticImages.T0.plusSeconds(120));
        new KeogramBuilder(param).build(SyntheticImages.series(SyntheticImages.T0, 10, 60));
    }

    @Test
    public void testTimeWindow() {
        KeogramBuildParam param = new KeogramBuildParam(0);
        param.setStart(SyntheticImages.T0.plusSeconds(120));
        param.setEnd(SyntheticImages.T0.plusSeconds(480));
        Keogram keogram = new KeogramBuilder(param).build(SyntheticImages.series(SyntheticImages.T0, 20, 60));
        assertEquals(7, keogram.getDataPoints().length);
        assertEquals(SyntheticImages.T0.plusSeconds(120), keogram.getStartTime());
    }

    @Test(expected = IncompatibleImagesException.class)
    public void testIncompatibleImages() {
        AllskyImage grey = SyntheticImages.image(SyntheticImages.T0, 10);
        ImageInfo info = SyntheticImages.info(SyntheticImages.T0.plusSeconds(60), Mode.I).build();
        AllskyImage intensity = new AllskyImage(new PixelBuffer(Mode.I, 41, 41), info);
        new KeogramBuilder(0).build(new ImageList(Arrays.asList(grey, intensity)));
    }

    @Test(expected = ImageNotOrientedException.class)
    public void testUnalignedImage() {
        AllskyImage aligned = SyntheticImages.image(SyntheticImages.T0, 10);
        ImageInfo info = SyntheticImages.info(SyntheticImages.T0.plusSeconds(60), Mode.L).orientation(null).build();
        AllskyImage unaligned = new AllskyImage(new PixelBuffer(Mode.L, 41, 41), info);
        new KeogramBuilder(0).build(new ImageList(Arrays.asList(aligned, unaligned)));
    }

    @Test
    public void testWorkerFailurePropagates() {
        ImageList images = SyntheticImages.series(SyntheticImages.T0, 20, 60);
        IllegalStateException failure = new IllegalStateException("Corrupt image");
        ImageSource failing = new ImageSource() {
            @Override
            public int size() {
                return images.size();
            }

            @Override
            public ImageInfo getInfo(int index) {
                return images.getInfo(index);
            }

            @Override
            public AllskyImage getImage(int index) {
                if (index == 12) {
                    throw failure;
                }
                return images.getImage(index);
            }
        };
        try {
            new KeogramBuilder(0).buildParallel(failing, 4);
            fail("Build should have failed");
        } catch (IllegalStateException x) {
            assertSame(failure, x);
        }
    }

    @Test
    public void testSplit() {
        List<List<Integer>> split = KeogramBuilder.split(Arrays.asList(1, 2, 3, 4, 5, 6, 7), 3);
        assertEquals(Arrays.asList(1, 2, 3), split.get(0));
        assertEquals(Arrays.asList(4, 5), split.get(1));
        assertEquals(Arrays.asList(6, 7), split.get(2));
    }

    @Test
    public void testEvenStripWidthIsBumped() {
        KeogramBuildParam param = new KeogramBuildParam(0);
        param.setStripWidth(4);
        assertEquals(5, param.getStripWidth());
    }

    @Test(expected = ConfigurationException.class)
    public void testNonPositiveStripWidth() {
        new KeogramBuildParam(0).setStripWidth(0);
    }

    @Test
    public void testDataTimes() {
        Keogram keogram = new KeogramBuilder(0).build(SyntheticImages.series(SyntheticImages.T0, 5, 60));
        List<Instant> times = keogram.getDataTimes();
        assertEquals(5, times.size());
        for (int i = 0; i < times.size(); i++) {
            assertEquals(SyntheticImages.T0.plusSeconds(60 * i).toEpochMilli(), times.get(i).toEpochMilli(), 1);
        }
    }

    @Test
    public void testChunkCount() {
        assertEquals(1, KeogramBuilder.chunkCount(8, 3));
        assertEquals(2, KeogramBuilder.chunkCount(8, 5));
        assertEquals(4, KeogramBuilder.chunkCount(4, 20));
        assertEquals(1, KeogramBuilder.chunkCount(8, 1));
        for (List<Integer> chunk : KeogramBuilder.split(Arrays.asList(1, 2, 3, 4, 5), KeogramBuilder.chunkCount(8, 5))) {
            assertTrue(chunk.size() >= 2);
        }
    }

    @Test
    public void testParallelChunksCountImagesInWindow() {
        ImageList images = SyntheticImages.series(SyntheticImages.T0, 20, 60);
        KeogramBuildParam param = new KeogramBuildParam(0);
        param.setParallelism(8);
        param.setStart(SyntheticImages.T0.plusSeconds(600));

        param.setEnd(SyntheticImages.T0.plusSeconds(720));
        Map<String, AtomicInteger> reads = new ConcurrentHashMap<>();
        Keogram narrow = new KeogramBuilder(param).buildParallel(countingReads(images, reads));
        assertEquals(new KeogramBuilder(param).build(images), narrow);
        assertEquals(Collections.singleton(Thread.currentThread().getName()), reads.keySet());

        param.setEnd(SyntheticImages.T0.plusSeconds(840));
        reads.clear();
        Keogram wider = new KeogramBuilder(param).buildParallel(countingReads(images, reads));
        assertEquals(new KeogramBuilder(param).build(images), wider);
        assertEquals(2, reads.size());
        for (Map.Entry<String, AtomicInteger> entry : reads.entrySet()) {
            assertTrue(entry.getKey(), entry.getKey().startsWith("keogram-worker-"));
            assertTrue(entry.getKey(), entry.getValue().get() >= 2);
        }
    }

    private static ImageSource countingReads(ImageList images, Map<String, AtomicInteger> reads) {
        return new ImageSource() {
            @Override
            public int size() {
                return images.size();
            }

            @Override
            public ImageInfo getInfo(int index) {
                return images.getInfo(index);
            }

            @Override
            public AllskyImage getImage(int index) {
                reads.computeIfAbsent(Thread.currentThread().getName(), name -> new AtomicInteger()).incrementAndGet();
                return images.getImage(index);
            }
        };
    }

    @Test
    public void testEquisolidAngleBuild() {
        ImageList series = SyntheticImages.series(SyntheticImages.T0, 10, 60);
        List<AllskyImage> images = new ArrayList<>();
        for (int i = 0; i < series.size(); i++) {
            AllskyImage image = series.getImage(i);
            images.add(new AllskyImage(image.getPixels(),
                    image.getInfo().toBuilder().lensProjection(LensProjection.EQUISOLIDANGLE).build()));
        }
        KeogramBuildParam param = new KeogramBuildParam(0);
        param.setFovRange(new FovRange(60, 120));
        Keogram keogram = new KeogramBuilder(param).build(new ImageList(images));

        assertEquals(LensProjection.EQUISOLIDANGLE, keogram.getLensProjection());
        assertEquals(new FovRange(60, 120), keogram.getFovRange());
        assertEquals(27, keogram.getHeight());

        // Rows of the 40 pixel band through the images, 45 to 135 degrees
        AngleMapper imageRows = LensProjection.EQUISOLIDANGLE.mapper(2 * SyntheticImages.RADIUS, FovRange.aroundZenith(90));
        PixelBuffer data = keogram.getData();
        int column = (int) Math.round(keogram.getDataPoints()[0]);
        for (double angle = 60; angle < 120; angle += 7.5) {
            Double row = keogram.angle2pix(angle);
            assertNotNull(row);
            assertEquals(angle, keogram.pix2angle(row), 1e-9);
            int imageRow = (int) Math.round(imageRows.angleToPixel(angle));
            assertEquals("angle " + angle, 10 + imageRow, data.get(column, (int) Math.round(row), 0), 1);
        }
        assertEquals(16, data.get(column, 0, 0));
        assertEquals(42, data.get(column, keogram.getHeight() - 1, 0));
    }

    @Test
    public void testWideGapIsLeftBlank() {
        long[] seconds = {0, 60, 120, 180, 240, 1200, 1260, 1320};
        List<AllskyImage> images = new ArrayList<>();
        for (int i = 0; i < seconds.length; i++) {
            images.add(SyntheticImages.image(SyntheticImages.T0.plusSeconds(seconds[i]), 10 + 20 * i));
        }
        Keogram keogram = new KeogramBuilder(0).build(new ImageList(images));
        assertEquals(220, keogram.getWidth());
        assertEquals(10, keogram.getDataSpacing());

        double[] points = keogram.getDataPoints();
        assertEquals(8, points.length);
        PixelBuffer data = keogram.getData();
        int firstBlank = (int) Math.round(points[4]) + 4;
        int lastBlank = (int) Math.round(points[5]) - 4;
        assertTrue(lastBlank - firstBlank > 100);
        for (int x = firstBlank; x <= lastBlank; x++) {
            for (int y = 0; y < keogram.getHeight(); y++) {
                assertEquals("column " + x, 0, data.get(x, y, 0));
            }
        }
        // Gaps of one data spacing are still filled
        int between = (int) Math.round((points[0] + points[1]) / 2);
        assertTrue(data.get(between, 10, 0) > 0);
    }
}
