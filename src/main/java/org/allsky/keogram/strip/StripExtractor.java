package org.allsky.keogram.strip;

import java.util.logging.Level;
import java.util.logging.Logger;
import org.allsky.keogram.ImageNotOrientedException;
import org.allsky.keogram.image.AllskyImage;
import org.allsky.keogram.image.ImageInfo;
import org.allsky.keogram.image.PixelBuffer;
import org.allsky.keogram.projection.AngleMapper;
import org.allsky.keogram.projection.FovRange;

/**
 * Cuts strips out of all-sky images for placement into a keogram.
 * <p>
 * An image is rotated so that the requested azimuth runs from top to bottom,
 * a band is taken through the centre of the image, and the band is then
 * reprojected from the field of view of the image onto the field of view and
 * height of the keogram. Parts of the keogram field of view not covered by the
 * image are left as background.
 */
public class StripExtractor {

    private static final Logger LOG = Logger.getLogger(StripExtractor.class.getName());

    private final double angle;
    private final int stripWidth;
    private final FovRange keoFov;
    private final int height;
    private final boolean preservePalette;

    /**
     * @param angle Azimuth (degrees from geographic north) to cut along
     * @param stripWidth Width of the band, in pixels
     * @param keoFov Field of view of the keogram
     * @param height Height of the keogram
     * @param preservePalette If true the strip is only ever resampled with
     * nearest neighbour sampling, so that every output pixel is a colour from
     * the input image
     */
    public StripExtractor(double angle, int stripWidth, FovRange keoFov, int height, boolean preservePalette) {
        if (stripWidth <= 0) {
            throw new IllegalArgumentException("Strip width must be positive");
        }
        this.angle = angle;
        this.stripWidth = stripWidth;
        this.keoFov = keoFov;
        this.height = height;
        this.preservePalette = preservePalette;
    }

    public Strip extract(AllskyImage image) {
        ImageInfo info = image.getInfo();
        checkPreconditions(info);

        PixelBuffer rotated = Resampling.rotate(image.getPixels(), info.getOrientation().rotationFor(angle, info.getCamRot()));
        PixelBuffer band = centralBand(rotated, 2 * info.getRadius());
        PixelBuffer corrected = correctFov(band, info);
        if (corrected.getHeight() != height) {
            LOG.log(Level.FINEST, "Resizing strip from {0} to {1} rows", new Object[]{corrected.getHeight(), height});
            corrected = Resampling.resizeRows(corrected, height, preservePalette);
        }
        return new Strip(corrected);
    }

    private static void checkPreconditions(ImageInfo info) {
        if (!info.isMasked()) {
            throw new ImageNotOrientedException("Image captured at " + info.getCaptureTime() + " has not been masked to its field of view");
        }
        if (!info.isCentred()) {
            throw new ImageNotOrientedException("Image captured at " + info.getCaptureTime() + " has not been centred");
        }
        if (info.getOrientation() == null) {
            throw new ImageNotOrientedException("Image captured at " + info.getCaptureTime() + " must be aligned with north");
        }
    }

    /**
     * Take the vertical band through the centre of the image. The band is
     * always one diameter tall, images smaller than their radius are padded
     * equally top and bottom with background.
     */
    private PixelBuffer centralBand(PixelBuffer image, int diameter) {
        int centre = (int) (image.getWidth() / 2.0 + 0.5) - 1;
        int lowerX = centre - stripWidth / 2;
        int lowerY = (diameter - image.getHeight()) / 2;
        PixelBuffer band = new PixelBuffer(image.getMode(), stripWidth, diameter);
        for (int x = 0; x < stripWidth; x++) {
            int sx = lowerX + x;
            if (sx < 0 || sx >= image.getWidth()) {
                continue;
            }
            for (int y = 0; y < image.getHeight(); y++) {
                int ty = y + lowerY;
                if (ty < 0 || ty >= diameter) {
                    continue;
                }
                for (int c = 0; c < image.getChannels(); c++) {
                    band.set(x, ty, c, image.get(sx, y, c));
                }
            }
        }
        return band;
    }

    /**
     * Reproject the band from the field of view of the image to that of the
     * keogram, keeping the pixel scale of the image.
     */
    private PixelBuffer correctFov(PixelBuffer band, ImageInfo info) {
        double imFovAngle = info.getFovAngle();
        FovRange imFov = FovRange.aroundZenith(imFovAngle);
        AngleMapper bandA2p = info.getLensProjection().mapper(band.getHeight(), imFov);

        double minFovPix = bandA2p.angleToPixel(keoFov.getMin());
        double maxFovPix = bandA2p.angleToPixel(keoFov.getMax());
        int rows = Math.max(2, (int) Math.round(maxFovPix - minFovPix) + 1);
        AngleMapper correctedA2p = info.getLensProjection().mapper(rows, keoFov);

        int bandLower;
        int correctedLower;
        if (keoFov.getMin() <= imFov.getMin()) {
            bandLower = 0;
            correctedLower = (int) Math.round(correctedA2p.angleToPixel(imFov.getMin()));
        } else {
            bandLower = (int) Math.round(minFovPix);
            correctedLower = 0;
        }
        int count;
        if (keoFov.getMax() >= imFov.getMax()) {
            count = band.getHeight() - bandLower;
        } else {
            count = rows - correctedLower;
        }

        PixelBuffer corrected = new PixelBuffer(band.getMode(), band.getWidth(), rows);
        for (int i = 0; i < count; i++) {
            int sy = bandLower + i;
            int ty = correctedLower + i;
            if (sy < 0 || sy >= band.getHeight() || ty < 0 || ty >= rows) {
                continue;
            }
            for (int x = 0; x < band.getWidth(); x++) {
                for (int c = 0; c < band.getChannels(); c++) {
                    corrected.set(x, ty, c, band.get(x, sy, c));
                }
            }
        }
        return corrected;
    }

    public double getAngle() {
        return angle;
    }

    public int getStripWidth() {
        return stripWidth;
    }

    public FovRange getKeoFov() {
        return keoFov;
    }

    public int getHeight() {
        return height;
    }
}
