package org.allsky.keogram.fits;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.util.Arrays;
import org.allsky.keogram.Keogram;
import org.allsky.keogram.KeogramBuilder;
import org.allsky.keogram.SyntheticImages;
import org.allsky.keogram.cmap.ColourTable;
import org.allsky.keogram.image.AllskyImage;
import org.allsky.keogram.image.ImageInfo;
import org.allsky.keogram.image.ImageList;
import org.allsky.keogram.image.Mode;
import org.allsky.keogram.image.PixelBuffer;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class FitsImageDatasetTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private ImageList images;
    private File directory;

    @Before
    public void writeImages() throws IOException {
        images = SyntheticImages.series(SyntheticImages.T0, 12, 60);
        directory = folder.newFolder("images");
        // Written in reverse so that file order and time order differ
        for (int i = 0; i < images.size(); i++) {
            File file = new File(directory, String.format("img_%02d.fits", images.size() - i));
            AllskyImageFits.write(images.getImage(i), file);
        }
        Files.write(new File(directory, "notes.txt").toPath(), Arrays.asList("not an image"));
    }

    @Test
    public void testDatasetIsTimeOrdered() throws IOException {
        FitsImageDataset dataset = new FitsImageDataset(directory);
        assertEquals(12, dataset.size());
        for (int i = 0; i < dataset.size(); i++) {
            assertEquals(images.getInfo(i).getCaptureTime(), dataset.getInfo(i).getCaptureTime());
            assertEquals(images.getImage(i).getPixels(), dataset.getImage(i).getPixels());
        }
        assertEquals("img_12.fits", dataset.getFile(0).getName());
    }

    @Test
    public void testBuildFromFiles() throws IOException {
        FitsImageDataset dataset = new FitsImageDataset(directory);
        KeogramBuilder builder = new KeogramBuilder(0);
        Keogram fromFiles = builder.buildParallel(dataset, 3);
        assertEquals(builder.build(images), fromFiles);
        dataset.logStatistics();
    }

    @Test
    public void testImageMetadata() throws IOException {
        ImageInfo info = SyntheticImages.info(SyntheticImages.T0, Mode.I)
                .camRot(12.5)
                .calibrationFactor(0.25)
                .wavelength("630.0")
                .colourTable(new ColourTable(new int[]{0, 0xffffff}))
                .orientation(null)
                .build();
        PixelBuffer pixels = new PixelBuffer(Mode.I, SyntheticImages.SIZE, SyntheticImages.SIZE);
        pixels.set(3, 4, 0, 123456);
        File file = folder.newFile("intensity.fits");
        AllskyImageFits.write(new AllskyImage(pixels, info), file);

        AllskyImage read = AllskyImageFits.read(file);
        assertEquals(pixels, read.getPixels());
        ImageInfo readInfo = read.getInfo();
        assertEquals(Mode.I, readInfo.getMode());
        assertEquals(12.5, readInfo.getCamRot(), 0);
        assertEquals(0.25, readInfo.getCalibrationFactor(), 0);
        assertEquals("630.0", readInfo.getWavelength());
        assertEquals(info.getColourTable(), readInfo.getColourTable());
        assertNull(readInfo.getOrientation());
        assertEquals(SyntheticImages.RADIUS, readInfo.getRadius());
    }

    @Test(expected = UncheckedIOException.class)
    public void testDeletedFile() throws IOException {
        FitsImageDataset dataset = new FitsImageDataset(directory);
        Files.delete(dataset.getFile(4).toPath());
        dataset.getImage(4);
    }
}
