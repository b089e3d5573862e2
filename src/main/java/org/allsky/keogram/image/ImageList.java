package org.allsky.keogram.image;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * An in-memory image source. The images are sorted by capture time on
 * construction.
 */
public class ImageList implements ImageSource {

    private final List<AllskyImage> images;

    public ImageList(Collection<AllskyImage> images) {
        this.images = new ArrayList<>(images);
        this.images.sort(Comparator.comparing((AllskyImage image) -> image.getInfo().getCaptureTime()));
    }

    @Override
    public int size() {
        return images.size();
    }

    @Override
    public ImageInfo getInfo(int index) {
        return images.get(index).getInfo();
    }

    @Override
    public AllskyImage getImage(int index) {
        return images.get(index);
    }
}
