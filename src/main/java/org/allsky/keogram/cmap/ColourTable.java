package org.allsky.keogram.cmap;

import java.util.Arrays;

/**
 * An ordered palette of RGB colours. A keogram with a colour table applied
 * holds either indices into the table (L and I modes) or colours taken from
 * it (RGB mode).
 */
public class ColourTable {

    private final int[] rgb;

    public ColourTable(int[] rgb) {
        if (rgb.length == 0) {
            throw new IllegalArgumentException("Empty colour table");
        }
        this.rgb = new int[rgb.length];
        for (int i = 0; i < rgb.length; i++) {
            this.rgb[i] = rgb[i] & 0xffffff;
        }
    }

    /**
     * Create a colour table from a list of (r, g, b) triples.
     *
     * @param entries Array of size n x 3
     * @return The colour table
     */
    public static ColourTable fromTriples(int[][] entries) {
        int[] rgb = new int[entries.length];
        for (int i = 0; i < entries.length; i++) {
            if (entries[i].length != 3) {
                throw new IllegalArgumentException("Colour table entry " + i + " is not an (r,g,b) triple");
            }
            rgb[i] = (entries[i][0] & 0xff) << 16 | (entries[i][1] & 0xff) << 8 | (entries[i][2] & 0xff);
        }
        return new ColourTable(rgb);
    }

    public int getRGB(int index) {
        return rgb[index];
    }

    public int getSize() {
        return rgb.length;
    }

    /**
     * Find the first occurrence of a colour in the table.
     *
     * @param colour Packed 0xRRGGBB colour
     * @return The index, or -1 if the colour is not in the table
     */
    public int indexOf(int colour) {
        for (int i = 0; i < rgb.length; i++) {
            if (rgb[i] == colour) {
                return i;
            }
        }
        return -1;
    }

    public boolean contains(int colour) {
        return indexOf(colour) >= 0;
    }

    public int[][] toTriples() {
        int[][] result = new int[rgb.length][3];
        for (int i = 0; i < rgb.length; i++) {
            result[i][0] = (rgb[i] >> 16) & 0xff;
            result[i][1] = (rgb[i] >> 8) & 0xff;
            result[i][2] = rgb[i] & 0xff;
        }
        return result;
    }

    @Override
    public String toString() {
        return "ColourTable{" + "size=" + rgb.length + '}';
    }

    @Override
    public int hashCode() {
        return 59 * 7 + Arrays.hashCode(this.rgb);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ColourTable)) {
            return false;
        }
        return Arrays.equals(this.rgb, ((ColourTable) obj).rgb);
    }
}
