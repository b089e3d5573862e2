package org.allsky.keogram.fits;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.util.BufferedFile;
import org.allsky.keogram.image.AllskyImage;
import org.allsky.keogram.image.ImageInfo;
import org.allsky.keogram.image.Mode;
import org.allsky.keogram.image.Orientation;
import org.allsky.keogram.image.PixelBuffer;
import org.allsky.keogram.projection.LensProjection;

/**
 * Reads and writes single all-sky images, with their metadata, as FITS
 * files.
 */
public final class AllskyImageFits {

    private static final String NOT_ALIGNED = "NONE";

    private AllskyImageFits() {
    }

    /**
     * Read only the metadata of an image. The pixel data is not read.
     *
     * @param file The FITS file
     * @return The metadata
     * @throws IOException If the file cannot be read or lacks required
     * keywords
     */
    public static ImageInfo readInfo(File file) throws IOException {
        try (Fits fits = new Fits(file)) {
            return readInfo(readHDUs(fits, file), file);
        } catch (FitsException x) {
            throw new IOException("Error reading image header from " + file, x);
        }
    }

    public static AllskyImage read(File file) throws IOException {
        try (Fits fits = new Fits(file)) {
            BasicHDU<?>[] hdus = readHDUs(fits, file);
            ImageInfo info = readInfo(hdus, file);
            PixelBuffer pixels = PixelArrays.fromArray(hdus[0].getKernel(), info.getMode());
            return new AllskyImage(pixels, info);
        } catch (FitsException x) {
            throw new IOException("Error reading image from " + file, x);
        }
    }

    public static void write(AllskyImage image, File file) throws IOException {
        ImageInfo info = image.getInfo();
        try {
            Fits fits = new Fits();
            BasicHDU<?> primary = Fits.makeHDU(PixelArrays.toArray(image.getPixels()));
            fits.addHDU(primary);
            Header header = primary.getHeader();
            header.addValue("DATE-OBS", info.getCaptureTime().toString(), "Capture time");
            header.addValue("FOVANGLE", info.getFovAngle(), "Field of view half angle (degrees)");
            header.addValue("LENSPROJ", info.getLensProjection().getProjectionName(), "Lens projection");
            header.addValue("RADIUS", info.getRadius(), "Field of view radius (pixels)");
            header.addValue("CENTREX", info.getCentreX(), "Field of view centre x (pixels)");
            header.addValue("CENTREY", info.getCentreY(), "Field of view centre y (pixels)");
            header.addValue("CAMROT", info.getCamRot(), "Camera rotation from north (degrees)");
            header.addValue("ORIENT", info.getOrientation() == null ? NOT_ALIGNED : info.getOrientation().name(), "Orientation");
            header.addValue("CENTRED", info.isCentred(), "Image has been centred");
            header.addValue("MASKED", info.isMasked(), "Image has been masked");
            if (info.getCalibrationFactor() != null) {
                header.addValue("CALIBFAC", info.getCalibrationFactor(), "Conversion of pixel values to kR");
            }
            if (info.getWavelength() != null) {
                header.addValue("WAVELEN", info.getWavelength(), "Wavelength");
            }
            header.addValue("COLMODE", info.getMode().name(), "Pixel mode");
            if (info.getColourTable() != null) {
                PixelArrays.addColourTable(fits, info.getColourTable());
            }
            Files.deleteIfExists(file.toPath());
            try (BufferedFile bf = new BufferedFile(file, "rw")) {
                fits.write(bf);
            }
        } catch (FitsException x) {
            throw new IOException("Error writing image to " + file, x);
        }
    }

    private static BasicHDU<?>[] readHDUs(Fits fits, File file) throws FitsException, IOException {
        BasicHDU<?>[] hdus = fits.read();
        if (hdus == null || hdus.length == 0) {
            throw new IOException("No data in " + file);
        }
        return hdus;
    }

    private static ImageInfo readInfo(BasicHDU<?>[] hdus, File file) throws FitsException, IOException {
        Header header = hdus[0].getHeader();
        String projection = header.getStringValue("LENSPROJ");
        ImageInfo.Builder builder = ImageInfo.builder()
                .captureTime(KeogramFits.parseInstant(KeogramFits.requireString(header, "DATE-OBS", file), file))
                .mode(Mode.forName(KeogramFits.requireString(header, "COLMODE", file)))
                .fovAngle(header.getDoubleValue("FOVANGLE", 90))
                .lensProjection(projection == null ? LensProjection.EQUIDISTANT : LensProjection.fromName(projection))
                .radius(header.getIntValue("RADIUS"))
                .centre(header.getIntValue("CENTREX"), header.getIntValue("CENTREY"))
                .camRot(header.getDoubleValue("CAMROT", 0))
                .centred(header.getBooleanValue("CENTRED"))
                .masked(header.getBooleanValue("MASKED"))
                .wavelength(header.getStringValue("WAVELEN"));
        String orientation = header.getStringValue("ORIENT");
        if (orientation != null && !NOT_ALIGNED.equals(orientation)) {
            try {
                builder.orientation(Orientation.valueOf(orientation));
            } catch (IllegalArgumentException x) {
                throw new IOException("Invalid orientation " + orientation + " in " + file, x);
            }
        }
        if (header.containsKey("CALIBFAC")) {
            builder.calibrationFactor(header.getDoubleValue("CALIBFAC"));
        }
        BasicHDU<?> table = PixelArrays.findExtension(hdus, PixelArrays.COLOUR_TABLE_EXTENSION);
        if (table != null) {
            builder.colourTable(PixelArrays.readColourTable(table));
        }
        try {
            return builder.build();
        } catch (IllegalArgumentException x) {
            throw new IOException("Invalid image metadata in " + file, x);
        }
    }
}
