package org.allsky.keogram.fits;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.allsky.keogram.Timed;
import org.allsky.keogram.image.AllskyImage;
import org.allsky.keogram.image.ImageInfo;
import org.allsky.keogram.image.ImageSource;

/**
 * An image source backed by a directory of FITS files. Headers are read up
 * front, so the dataset can be sorted and a keogram planned without reading
 * any pixels. Pixel data is read on demand through a Caffeine cache, which is
 * safe to use from several build workers at once.
 */
public class FitsImageDataset implements ImageSource {

    private static final Logger LOG = Logger.getLogger(FitsImageDataset.class.getName());

    private final List<Entry> entries;
    private final LoadingCache<File, AllskyImage> imageCache;

    public FitsImageDataset(File directory) throws IOException {
        this(listFitsFiles(directory));
    }

    public FitsImageDataset(List<File> files) throws IOException {
        List<Entry> list = new ArrayList<>(files.size());
        for (File file : files) {
            list.add(new Entry(file, AllskyImageFits.readInfo(file)));
        }
        list.sort(Comparator.comparing((Entry entry) -> entry.info.getCaptureTime()));
        entries = Collections.unmodifiableList(list);
        imageCache = Caffeine.newBuilder()
                .maximumSize(Integer.getInteger("org.allsky.keogram.imageCacheSize", 50))
                .recordStats()
                .build((File file) -> {
                    return Timed.execute(() -> {
                        return AllskyImageFits.read(file);
                    }, "Loading %s took %dms", file.getName());
                });
        LOG.log(Level.FINE, "Read headers of {0} images", entries.size());
    }

    private static List<File> listFitsFiles(File directory) throws IOException {
        File[] files = directory.listFiles((File dir, String name) -> {
            String lower = name.toLowerCase();
            return lower.endsWith(".fits") || lower.endsWith(".fit") || lower.endsWith(".fts");
        });
        if (files == null) {
            throw new IOException("Cannot list directory " + directory);
        }
        List<File> result = new ArrayList<>(files.length);
        Collections.addAll(result, files);
        Collections.sort(result);
        return result;
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public ImageInfo getInfo(int index) {
        return entries.get(index).info;
    }

    public File getFile(int index) {
        return entries.get(index).file;
    }

    @Override
    public AllskyImage getImage(int index) {
        File file = entries.get(index).file;
        try {
            return imageCache.get(file);
        } catch (CompletionException x) {
            Throwable cause = x.getCause();
            if (cause instanceof IOException) {
                throw new UncheckedIOException((IOException) cause);
            } else {
                throw new UncheckedIOException(new IOException("Unexpected exception reading " + file, cause));
            }
        }
    }

    public void logStatistics() {
        LOG.log(Level.INFO, "image Cache size {0} stats {1}", new Object[]{imageCache.estimatedSize(), imageCache.stats()});
    }

    private static class Entry {

        private final File file;
        private final ImageInfo info;

        Entry(File file, ImageInfo info) {
            this.file = file;
            this.info = info;
        }
    }
}
