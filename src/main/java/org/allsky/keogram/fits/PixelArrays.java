package org.allsky.keogram.fits;

import java.io.IOException;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import org.allsky.keogram.cmap.ColourTable;
import org.allsky.keogram.image.Mode;
import org.allsky.keogram.image.PixelBuffer;

/**
 * Conversion between pixel buffers and the arrays nom.tam.fits reads and
 * writes. Images are stored as [channel][row][column] arrays, so NAXIS1 is
 * the width, NAXIS2 the height and NAXIS3 the number of channels. L and RGB
 * data is written with BITPIX 8, I data with BITPIX 32.
 */
final class PixelArrays {

    static final String EXTNAME = "EXTNAME";
    static final String COLOUR_TABLE_EXTENSION = "COLTABLE";

    private PixelArrays() {
    }

    static Object toArray(PixelBuffer buffer) {
        int w = buffer.getWidth();
        int h = buffer.getHeight();
        int channels = buffer.getChannels();
        if (buffer.getMode().isEightBit()) {
            byte[][][] array = new byte[channels][h][w];
            for (int c = 0; c < channels; c++) {
                for (int y = 0; y < h; y++) {
                    for (int x = 0; x < w; x++) {
                        array[c][y][x] = (byte) buffer.get(x, y, c);
                    }
                }
            }
            return array;
        } else {
            int[][][] array = new int[channels][h][w];
            for (int c = 0; c < channels; c++) {
                for (int y = 0; y < h; y++) {
                    for (int x = 0; x < w; x++) {
                        array[c][y][x] = buffer.get(x, y, c);
                    }
                }
            }
            return array;
        }
    }

    static PixelBuffer fromArray(Object kernel, Mode mode) throws IOException {
        if (kernel instanceof byte[][][] && mode.isEightBit()) {
            byte[][][] array = (byte[][][]) kernel;
            PixelBuffer buffer = newBuffer(mode, array.length, array[0].length, array[0][0].length);
            for (int c = 0; c < array.length; c++) {
                for (int y = 0; y < array[c].length; y++) {
                    for (int x = 0; x < array[c][y].length; x++) {
                        buffer.set(x, y, c, array[c][y][x] & 0xff);
                    }
                }
            }
            return buffer;
        } else if (kernel instanceof int[][][] && mode == Mode.I) {
            int[][][] array = (int[][][]) kernel;
            PixelBuffer buffer = newBuffer(mode, array.length, array[0].length, array[0][0].length);
            for (int c = 0; c < array.length; c++) {
                for (int y = 0; y < array[c].length; y++) {
                    for (int x = 0; x < array[c][y].length; x++) {
                        buffer.set(x, y, c, array[c][y][x]);
                    }
                }
            }
            return buffer;
        } else {
            throw new IOException("Unexpected pixel data " + (kernel == null ? null : kernel.getClass().getSimpleName()) + " for mode " + mode);
        }
    }

    private static PixelBuffer newBuffer(Mode mode, int channels, int height, int width) throws IOException {
        if (channels != mode.getChannels()) {
            throw new IOException("Expected " + mode.getChannels() + " channels for mode " + mode + ", found " + channels);
        }
        return new PixelBuffer(mode, width, height);
    }

    static void addColourTable(Fits fits, ColourTable colourTable) throws FitsException {
        BasicHDU<?> hdu = Fits.makeHDU(colourTable.toTriples());
        fits.addHDU(hdu);
        hdu.getHeader().addValue(EXTNAME, COLOUR_TABLE_EXTENSION, "Colour table, one (r,g,b) triple per row");
    }

    static ColourTable readColourTable(BasicHDU<?> hdu) throws FitsException, IOException {
        Object kernel = hdu.getKernel();
        if (!(kernel instanceof int[][])) {
            throw new IOException("Unexpected colour table data " + (kernel == null ? null : kernel.getClass().getSimpleName()));
        }
        return ColourTable.fromTriples((int[][]) kernel);
    }

    static BasicHDU<?> findExtension(BasicHDU<?>[] hdus, String name) {
        for (int i = 1; i < hdus.length; i++) {
            Header header = hdus[i].getHeader();
            if (name.equals(header.getStringValue(EXTNAME))) {
                return hdus[i];
            }
        }
        return null;
    }
}
