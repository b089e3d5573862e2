package org.allsky.keogram.fits;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.logging.Level;
import java.util.logging.Logger;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.util.BufferedFile;
import org.allsky.keogram.KeoType;
import org.allsky.keogram.Keogram;
import org.allsky.keogram.cmap.ColourTable;
import org.allsky.keogram.image.Mode;
import org.allsky.keogram.image.PixelBuffer;
import org.allsky.keogram.projection.FovRange;
import org.allsky.keogram.projection.LensProjection;

/**
 * Saves and loads keograms as FITS files. The primary HDU holds the pixels
 * and the header keywords needed to rebuild the time and angle mappings. The
 * data points go in a DATAPTS image extension, and the colour table (if any)
 * in a COLTABLE extension.
 */
public final class KeogramFits {

    private static final Logger LOG = Logger.getLogger(KeogramFits.class.getName());

    static final String DATA_POINTS_EXTENSION = "DATAPTS";

    private KeogramFits() {
    }

    public static void save(Keogram keogram, File file) throws IOException {
        try {
            Fits fits = new Fits();
            BasicHDU<?> primary = Fits.makeHDU(PixelArrays.toArray(keogram.getData()));
            fits.addHDU(primary);
            Header header = primary.getHeader();
            header.addValue("KEOANGLE", keogram.getAngle(), "Azimuth of keogram (degrees from north)");
            header.addValue("DATE-BEG", keogram.getStartTime().toString(), "Start time of keogram");
            header.addValue("DATE-END", keogram.getEndTime().toString(), "End time of keogram");
            header.addValue("STRIPWID", keogram.getStripWidth(), "Strip width (pixels)");
            header.addValue("FOVMIN", keogram.getFovRange().getMin(), "Lower field of view bound (degrees)");
            header.addValue("FOVMAX", keogram.getFovRange().getMax(), "Upper field of view bound (degrees)");
            header.addValue("KEOTYPE", keogram.getKeoType().getTypeName(), "Strip placement");
            header.addValue("DATASPAC", keogram.getDataSpacing(), "Typical data spacing (pixels)");
            if (keogram.getCalibrationFactor() != null) {
                header.addValue("CALIBFAC", keogram.getCalibrationFactor(), "Conversion of pixel values to kR");
            }
            header.addValue("LENSPROJ", keogram.getLensProjection().getProjectionName(), "Lens projection");
            header.addValue("COLMODE", keogram.getMode().name(), "Pixel mode");
            double[] dataPoints = keogram.getDataPoints();
            header.addValue("NDATAPT", dataPoints.length, "Number of data points");

            if (dataPoints.length > 0) {
                BasicHDU<?> points = Fits.makeHDU(dataPoints);
                fits.addHDU(points);
                points.getHeader().addValue(PixelArrays.EXTNAME, DATA_POINTS_EXTENSION, "Columns holding real data");
            }
            if (keogram.getColourTable() != null) {
                PixelArrays.addColourTable(fits, keogram.getColourTable());
            }
            Files.deleteIfExists(file.toPath());
            try (BufferedFile bf = new BufferedFile(file, "rw")) {
                fits.write(bf);
            }
            LOG.log(Level.FINE, "Saved {0} to {1}", new Object[]{keogram, file});
        } catch (FitsException x) {
            throw new IOException("Error writing keogram to " + file, x);
        }
    }

    public static Keogram load(File file) throws IOException {
        try (Fits fits = new Fits(file)) {
            BasicHDU<?>[] hdus = fits.read();
            if (hdus == null || hdus.length == 0) {
                throw new IOException("No data in " + file);
            }
            Header header = hdus[0].getHeader();
            Mode mode = Mode.forName(requireString(header, "COLMODE", file));
            PixelBuffer data = PixelArrays.fromArray(hdus[0].getKernel(), mode);
            Instant start = parseInstant(requireString(header, "DATE-BEG", file), file);
            Instant end = parseInstant(requireString(header, "DATE-END", file), file);
            FovRange fov = new FovRange(header.getDoubleValue("FOVMIN"), header.getDoubleValue("FOVMAX"));
            LensProjection projection = LensProjection.fromName(requireString(header, "LENSPROJ", file));
            KeoType keoType = KeoType.fromName(requireString(header, "KEOTYPE", file));
            Double calibrationFactor = header.containsKey("CALIBFAC") ? header.getDoubleValue("CALIBFAC") : null;

            int nPoints = header.getIntValue("NDATAPT", 0);
            double[] dataPoints = new double[0];
            if (nPoints > 0) {
                BasicHDU<?> points = PixelArrays.findExtension(hdus, DATA_POINTS_EXTENSION);
                if (points == null || !(points.getKernel() instanceof double[])) {
                    throw new IOException("Missing or invalid " + DATA_POINTS_EXTENSION + " extension in " + file);
                }
                dataPoints = (double[]) points.getKernel();
                if (dataPoints.length != nPoints) {
                    throw new IOException("Expected " + nPoints + " data points, found " + dataPoints.length + " in " + file);
                }
            }
            ColourTable colourTable = null;
            BasicHDU<?> table = PixelArrays.findExtension(hdus, PixelArrays.COLOUR_TABLE_EXTENSION);
            if (table != null) {
                colourTable = PixelArrays.readColourTable(table);
            }
            return new Keogram(data, start, end, header.getDoubleValue("KEOANGLE"), fov, projection,
                    header.getIntValue("STRIPWID"), keoType, dataPoints, header.getIntValue("DATASPAC"),
                    colourTable, calibrationFactor);
        } catch (FitsException x) {
            throw new IOException("Error reading keogram from " + file, x);
        }
    }

    static String requireString(Header header, String key, File file) throws IOException {
        String value = header.getStringValue(key);
        if (value == null) {
            throw new IOException("Missing " + key + " while reading " + file);
        }
        return value;
    }

    static Instant parseInstant(String value, File file) throws IOException {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException x) {
            throw new IOException("Invalid time " + value + " in " + file, x);
        }
    }
}
