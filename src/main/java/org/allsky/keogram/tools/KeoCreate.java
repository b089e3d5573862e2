package org.allsky.keogram.tools;

import java.io.File;
import java.io.IOException;
import java.util.logging.Level;
import org.allsky.keogram.KeoType;
import org.allsky.keogram.Keogram;
import org.allsky.keogram.KeogramBuildParam;
import org.allsky.keogram.KeogramBuilder;
import org.allsky.keogram.Timed;
import org.allsky.keogram.fits.FitsImageDataset;
import org.allsky.keogram.fits.KeogramFits;

/**
 * Creates a keogram from a directory of FITS all-sky images and saves it as a
 * FITS file.
 */
public class KeoCreate {

    public static void main(String[] args) throws IOException {
        if (args.length < 3 || args.length > 5) {
            System.err.println("Usage: KeoCreate <directory> <angle> <output.fits> [stripWidth] [CopyPaste|Average]");
            System.exit(1);
        }
        File directory = new File(args[0]);
        KeogramBuildParam param = new KeogramBuildParam(Double.parseDouble(args[1]));
        File output = new File(args[2]);
        if (args.length > 3) {
            param.setStripWidth(Integer.parseInt(args[3]));
        }
        if (args.length > 4) {
            param.setKeoType(KeoType.fromName(args[4]));
        }

        FitsImageDataset dataset = new FitsImageDataset(directory);
        Keogram keogram = Timed.execute(Level.INFO, () -> new KeogramBuilder(param).buildParallel(dataset),
                "Building keogram from %s took %dms", directory);
        dataset.logStatistics();
        KeogramFits.save(keogram, output);
        System.out.printf("Wrote %dx%d keogram (%s - %s) to %s%n", keogram.getWidth(), keogram.getHeight(),
                keogram.getStartTime(), keogram.getEndTime(), output);
    }
}
