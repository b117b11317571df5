package org.lsst.fits.linedefect.batch;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import org.lsst.fits.linedefect.InspectionConfig;
import org.lsst.fits.linedefect.InspectionResult;
import org.lsst.fits.linedefect.LineDefectInspector;
import org.lsst.fits.linedefect.SensorImage;
import org.lsst.fits.linedefect.Timed;

/**
 * Inspects a batch of FITS files on a pool of worker threads. A file which
 * cannot be read is reported as an error and the rest of the batch carries
 * on.
 * <p>
 * Decoded images are kept in a Caffeine cache keyed by path, so inspecting
 * the same files again with different settings does not read them again.
 *
 * @author tonyj
 */
public class BatchInspector implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(BatchInspector.class.getName());

    private final LineDefectInspector inspector = new LineDefectInspector();
    private final LoadingCache<Path, SensorImage> imageCache;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    public BatchInspector() {
        this(Executors.newFixedThreadPool(Integer.getInteger("org.lsst.fits.linedefect.threads", Runtime.getRuntime().availableProcessors())), true);
    }

    /**
     * Create a batch inspector using the given executor. The executor is not
     * shut down by {@link #close()}.
     */
    public BatchInspector(ExecutorService executor) {
        this(executor, false);
    }

    private BatchInspector(ExecutorService executor, boolean ownsExecutor) {
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
        FitsImageLoader loader = new FitsImageLoader();
        imageCache = Caffeine.newBuilder()
                .maximumSize(Integer.getInteger("org.lsst.fits.linedefect.imageCacheSize", 100))
                .recordStats()
                .build((Path path) -> Timed.execute(() -> loader.load(path), "Loading %s took %dms", path));
    }

    /**
     * Inspect every file. The results are in the same order as the files.
     *
     * @param files The FITS files to inspect
     * @param config The inspection options
     * @return One result per file
     */
    public List<BatchItemResult> inspect(List<Path> files, InspectionConfig config) {
        List<CompletableFuture<BatchItemResult>> futures = files.stream()
                .map(path -> CompletableFuture.supplyAsync(() -> inspect(path, config), executor))
                .collect(Collectors.toList());
        LOG.log(Level.INFO, "Waiting for {0} files", futures.size());
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[futures.size()])).join();
        List<BatchItemResult> results = futures.stream().map(CompletableFuture::join).collect(Collectors.toList());
        LOG.log(Level.INFO, "Inspected {0} files: {1} failed, {2} errors", new Object[]{
            results.size(), count(results, BatchItemResult.Status.FAIL), count(results, BatchItemResult.Status.ERROR)});
        return results;
    }

    BatchItemResult inspect(Path path, InspectionConfig config) {
        try {
            Timed.Timing<InspectionResult> timing = Timed.measure(Level.FINE,
                    () -> inspector.inspect(imageCache.get(path), config), "Inspecting %s took %dms", path);
            return BatchItemResult.inspected(path, timing.getValue(), timing.getElapsedMillis());
        } catch (CompletionException x) {
            Throwable cause = x.getCause() == null ? x : x.getCause();
            LOG.log(Level.WARNING, "Skipping unreadable file " + path, cause);
            return BatchItemResult.failed(path, cause);
        } catch (RuntimeException x) {
            LOG.log(Level.WARNING, "Inspection of " + path + " failed", x);
            return BatchItemResult.failed(path, x);
        }
    }

    private static long count(List<BatchItemResult> results, BatchItemResult.Status status) {
        return results.stream().filter(r -> r.getStatus() == status).count();
    }

    public CacheStats getImageCacheStats() {
        return imageCache.stats();
    }

    void report() {
        LOG.log(Level.INFO, "image Cache size {0} stats {1}", new Object[]{imageCache.estimatedSize(), imageCache.stats()});
    }

    @Override
    public void close() {
        report();
        if (ownsExecutor) {
            executor.shutdown();
        }
    }
}
