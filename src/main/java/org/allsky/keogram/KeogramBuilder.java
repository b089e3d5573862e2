package org.allsky.keogram;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.allsky.keogram.image.AllskyImage;
import org.allsky.keogram.image.ImageSource;
import org.allsky.keogram.image.PixelBuffer;
import org.allsky.keogram.interp.NullInterpolator;
import org.allsky.keogram.strip.StripExtractor;

/**
 * Builds keograms from a source of all-sky images. Images are read one at a
 * time, so the source may be much larger than available memory.
 * <p>
 * The parallel build splits the images into contiguous chunks, builds an
 * un-interpolated keogram of each chunk on its own thread against a shared
 * geometry, and merges the results on the calling thread. The result is the
 * same as that of the sequential build.
 */
public class KeogramBuilder {

    private static final Logger LOG = Logger.getLogger(KeogramBuilder.class.getName());

    private final KeogramBuildParam param;

    public KeogramBuilder(KeogramBuildParam param) {
        this.param = param;
    }

    public KeogramBuilder(double angle) {
        this(new KeogramBuildParam(angle));
    }

    public KeogramBuildParam getParam() {
        return param;
    }

    /**
     * Build a keogram on the calling thread.
     *
     * @param source The images
     * @return The keogram
     */
    public Keogram build(ImageSource source) {
        KeogramGeometry geometry = KeogramGeometry.plan(source, param);
        List<Integer> indices = selectImages(source, geometry);
        Keogram partial = Timed.execute(() -> buildPartial(source, geometry, indices),
                "Placed %d strips in %dms", indices.size());
        Keogram keogram = KeogramCombiner.merge(Collections.singletonList(partial), geometry);
        LOG.log(Level.INFO, "Built {0}x{1} keogram from {2} images", new Object[]{keogram.getWidth(), keogram.getHeight(), indices.size()});
        return keogram;
    }

    /**
     * Build a keogram using as many workers as the configured parallelism
     * allows, but no more than one per two images.
     *
     * @param source The images
     * @return The keogram
     */
    public Keogram buildParallel(ImageSource source) {
        return buildParallel(source, param.getParallelism());
    }

    /**
     * Build a keogram with the images in the time window split into at most
     * the given number of chunks, each built on its own thread. Every chunk
     * holds at least two images. If any chunk fails the others are cancelled
     * and the failure is rethrown.
     *
     * @param source The images
     * @param chunks The largest number of chunks
     * @return The keogram
     */
    public Keogram buildParallel(ImageSource source, int chunks) {
        if (chunks <= 0) {
            throw new ConfigurationException("Number of chunks must be positive, got " + chunks);
        }
        KeogramGeometry geometry = KeogramGeometry.plan(source, param);
        List<Integer> indices = selectImages(source, geometry);
        List<List<Integer>> split = split(indices, chunkCount(chunks, indices.size()));
        if (split.size() == 1) {
            return build(source);
        }

        ExecutorService executor = Executors.newFixedThreadPool(split.size(), new WorkerThreadFactory());
        try {
            List<CompletableFuture<Keogram>> futures = new ArrayList<>(split.size());
            CompletableFuture<Void> failure = new CompletableFuture<>();
            for (List<Integer> chunk : split) {
                CompletableFuture<Keogram> future = CompletableFuture.supplyAsync(() -> {
                    return Timed.execute(() -> buildPartial(source, geometry, chunk),
                            "Placed chunk of %d strips in %dms", chunk.size());
                }, executor);
                future.whenComplete((keogram, x) -> {
                    if (x != null) {
                        failure.completeExceptionally(x);
                    }
                });
                futures.add(future);
            }
            try {
                CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture[futures.size()]));
                CompletableFuture.anyOf(all, failure).join();
            } catch (CompletionException x) {
                for (CompletableFuture<Keogram> future : futures) {
                    future.cancel(true);
                }
                executor.shutdownNow();
                Throwable cause = x.getCause();
                LOG.log(Level.WARNING, "Parallel keogram build failed", cause);
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                } else if (cause instanceof Error) {
                    throw (Error) cause;
                } else {
                    throw new KeogramException("Unexpected exception during keogram build", cause);
                }
            }
            List<Keogram> partials = new ArrayList<>(futures.size());
            for (CompletableFuture<Keogram> future : futures) {
                partials.add(future.join());
            }
            Keogram keogram = Timed.execute(() -> KeogramCombiner.merge(partials, geometry),
                    "Merged %d partial keograms in %dms", partials.size());
            LOG.log(Level.INFO, "Built {0}x{1} keogram from {2} images using {3} workers",
                    new Object[]{keogram.getWidth(), keogram.getHeight(), indices.size(), split.size()});
            return keogram;
        } finally {
            executor.shutdownNow();
        }
    }

    private static List<Integer> selectImages(ImageSource source, KeogramGeometry geometry) {
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < source.size(); i++) {
            if (geometry.contains(source.getInfo(i).getCaptureTime())) {
                indices.add(i);
            }
        }
        return indices;
    }

    static int chunkCount(int requested, int imageCount) {
        return Math.max(1, Math.min(requested, imageCount / 2));
    }

    /**
     * Split a list into contiguous chunks whose sizes differ by at most one.
     */
    static <T> List<List<T>> split(List<T> list, int chunks) {
        List<List<T>> result = new ArrayList<>(chunks);
        int base = list.size() / chunks;
        int extra = list.size() % chunks;
        int from = 0;
        for (int i = 0; i < chunks; i++) {
            int to = from + base + (i < extra ? 1 : 0);
            result.add(list.subList(from, to));
            from = to;
        }
        return result;
    }

    /**
     * Place the strips of some of the images into an empty buffer, without
     * interpolating.
     */
    static Keogram buildPartial(ImageSource source, KeogramGeometry geometry, List<Integer> indices) {
        PixelBuffer buffer = new PixelBuffer(geometry.getMode(), geometry.getWidth(), geometry.getHeight());
        Accumulator accumulator = new Accumulator(buffer, geometry.timeMapper(), geometry.getKeoType());
        StripExtractor extractor = geometry.stripExtractor();
        double[] points = new double[indices.size()];
        int n = 0;
        for (int index : indices) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Keogram build interrupted");
            }
            AllskyImage image = source.getImage(index);
            points[n++] = accumulator.putStrip(extractor.extract(image), image.getInfo().getCaptureTime());
        }
        return Keogram.assemble(buffer, geometry, points, new NullInterpolator());
    }

    private static class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "keogram-worker-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
