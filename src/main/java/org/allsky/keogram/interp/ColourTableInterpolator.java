package org.allsky.keogram.interp;

import org.allsky.keogram.cmap.ColourTable;
import org.allsky.keogram.image.PixelBuffer;

/**
 * Interpolates an RGB keogram through the indices of its colour table, so
 * that every synthesised pixel is a palette colour. Rows whose end points are
 * not palette colours are left untouched.
 */
public class ColourTableInterpolator extends GapInterpolator {

    private final ColourTable colourTable;

    public ColourTableInterpolator(ColourTable colourTable) {
        this.colourTable = colourTable;
    }

    @Override
    void fill(PixelBuffer buffer, int left, int right) {
        int span = right - left;
        for (int y = 0; y < buffer.getHeight(); y++) {
            int start = colourTable.indexOf(buffer.getRGB(left, y));
            int end = colourTable.indexOf(buffer.getRGB(right, y));
            if (start < 0 || end < 0) {
                continue;
            }
            double gradient = (double) (end - start) / span;
            for (int x = left + 1; x < right; x++) {
                int index = (int) Math.round(start + gradient * (x - left));
                buffer.setRGB(x, y, colourTable.getRGB(index));
            }
        }
    }

    public ColourTable getColourTable() {
        return colourTable;
    }
}
