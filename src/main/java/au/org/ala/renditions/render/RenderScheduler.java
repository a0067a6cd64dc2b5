package au.org.ala.renditions.render;

import au.org.ala.renditions.source.SourceImage;
import au.org.ala.renditions.spec.RenditionSpec;
import au.org.ala.renditions.store.RenditionStore;
import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the shared render pool and decides when a rendition needs to be produced.
 * <p>
 * The pool is started on first use. At most one job per output path is outstanding at any time, and the
 * per-source lock on {@link SourceImage} keeps decodes of the same source from overlapping. Callers never
 * wait on a render.
 */
public class RenderScheduler {

    private static final Logger log = LoggerFactory.getLogger(RenderScheduler.class);

    private final RenditionStore store;
    private final RenditionRenderer renderer;
    private final int threads;

    private final Set<Path> outstanding = ConcurrentHashMap.newKeySet();
    private volatile ExecutorService pool;
    private Thread shutdownHook;

    public RenderScheduler(RenditionStore store, RenditionRenderer renderer, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, was " + threads);
        }
        this.store = store;
        this.renderer = renderer;
        this.threads = threads;
    }

    public RenditionStore getStore() {
        return store;
    }

    /**
     * Look the rendition up and, if it is missing and {@code eager} is set, queue a render for it.
     *
     * @return the rendition location, pending if it is not on disk yet
     */
    public RenderStatus ensureRendition(SourceImage source, RenditionSpec spec, double outputScale, boolean eager) {
        RenditionStore.Resolution resolution = store.resolve(source, spec, outputScale);
        if (resolution.exists()) {
            log.debug("Cache hit for {}", resolution.getRelativePath());
            return new RenderStatus(resolution, false);
        }
        if (eager) {
            Path output = resolution.getPath();
            if (outstanding.add(output)) {
                try {
                    executor().execute(() -> renderJob(source, resolution));
                } catch (RuntimeException e) {
                    outstanding.remove(output);
                    throw e;
                }
            } else {
                log.debug("Render of {} already outstanding", resolution.getRelativePath());
            }
        }
        return new RenderStatus(resolution, true);
    }

    /** Run a maintenance task on the render pool. */
    public Future<?> submit(Runnable task) {
        return executor().submit(task);
    }

    /** True while a render job for the output path is queued or running */
    public boolean isOutstanding(Path output) {
        return outstanding.contains(output);
    }

    void renderJob(SourceImage source, RenditionStore.Resolution resolution) {
        Path output = resolution.getPath();
        ReentrantLock lock = source.getRenderLock();
        lock.lock();
        try {
            if (Files.exists(output)) {
                log.debug("{} was rendered while queued", resolution.getRelativePath());
                return;
            }
            Stopwatch sw = Stopwatch.createStarted();
            log.info("Rendering {} -> {}", source.getPath(), output);
            store.prepare(resolution);
            renderer.render(source, resolution.getPipeline(), store.sinkFor(resolution));
            log.info("Rendered {} in {}", resolution.getRelativePath(), sw);
        } catch (Exception e) {
            log.error("Failed to render {} -> {}", source.getPath(), output, e);
        } finally {
            lock.unlock();
            outstanding.remove(output);
        }
    }

    private ExecutorService executor() {
        ExecutorService result = pool;
        if (result == null) {
            synchronized (this) {
                result = pool;
                if (result == null) {
                    log.info("Starting render pool with {} threads", threads);
                    result = Executors.newFixedThreadPool(threads,
                            new ThreadFactoryBuilder().setNameFormat("Renderer-%d").setDaemon(true).build());
                    pool = result;
                }
            }
        }
        return result;
    }

    /**
     * Stop accepting work and wait for running jobs to finish.
     *
     * @return true if the pool terminated within the timeout (or was never started)
     */
    public synchronized boolean shutdown(long timeout, TimeUnit unit) {
        ExecutorService current = pool;
        pool = null;
        if (current == null) {
            return true;
        }
        return MoreExecutors.shutdownAndAwaitTermination(current, timeout, unit);
    }

    /** Shut the pool down cleanly when the JVM exits. */
    public synchronized void registerShutdownHook() {
        if (shutdownHook == null) {
            shutdownHook = new Thread(() -> shutdown(30, TimeUnit.SECONDS), "Renderer-shutdown");
            Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
    }
}
