package org.allsky.keogram.image;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * An ordered (by capture time) provider of all-sky images. Metadata is
 * available without decoding the images, so that a keogram can be planned
 * before any pixel data is touched.
 */
public interface ImageSource {

    int size();

    ImageInfo getInfo(int index);

    AllskyImage getImage(int index);

    default boolean isEmpty() {
        return size() == 0;
    }

    default List<Instant> getTimes() {
        List<Instant> times = new ArrayList<>(size());
        for (int i = 0; i < size(); i++) {
            times.add(getInfo(i).getCaptureTime());
        }
        return times;
    }
}
