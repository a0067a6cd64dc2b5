package au.org.ala.renditions;

import au.org.ala.renditions.cache.CacheJanitor;
import au.org.ala.renditions.cache.MaintenanceTasks;
import au.org.ala.renditions.delivery.AsyncRenditionHandler;
import au.org.ala.renditions.delivery.PendingToken;
import au.org.ala.renditions.delivery.PendingTokenCodec;
import au.org.ala.renditions.pipeline.PipelineBuilder;
import au.org.ala.renditions.render.DefaultRenditionRenderer;
import au.org.ala.renditions.render.RenderScheduler;
import au.org.ala.renditions.render.RenderStatus;
import au.org.ala.renditions.render.RenditionRenderer;
import au.org.ala.renditions.sizing.SizePlanner;
import au.org.ala.renditions.source.ImageProbe;
import au.org.ala.renditions.source.ImageRef;
import au.org.ala.renditions.source.ImageRefResolver;
import au.org.ala.renditions.source.SourceImage;
import au.org.ala.renditions.source.SourceImageRegistry;
import au.org.ala.renditions.spec.RenditionSpec;
import au.org.ala.renditions.store.RenditionStore;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for the rendering layer: look up images, get rendition URLs for them, serve the async endpoint
 * and keep the cache tidy.
 * <p>
 * Page rendering should use {@link #getRendition}, which never starts work: a missing rendition comes back as an
 * async URL, and the render is started when the browser requests it.
 */
public class RenditionService {

    private static final Logger log = LoggerFactory.getLogger(RenditionService.class);

    private static final String CACHE_SWEEP_TASK = "rendition-cache-sweep";

    private final RenditionConfig config;
    private final SourceImageRegistry registry;
    private final RenderScheduler scheduler;
    private final PendingTokenCodec tokenCodec;
    private final AsyncRenditionHandler asyncHandler;
    private final CacheJanitor janitor;
    private final MaintenanceTasks maintenance;
    private final ImageRefResolver resolver;

    public RenditionService(RenditionConfig config) {
        this(config, new DefaultRenditionRenderer(), new MaintenanceTasks());
    }

    public RenditionService(RenditionConfig config, RenditionRenderer renderer, MaintenanceTasks maintenance) {
        this.config = config;
        this.registry = new SourceImageRegistry(new ImageProbe(config.getRenditionVersion()));
        RenditionStore store = new RenditionStore(config.getStaticFolder(), config.getOutputSubdir(),
                new PipelineBuilder(SizePlanner.INSTANCE, config.getDefaultScaleFilter()));
        this.scheduler = new RenderScheduler(store, renderer, config.getRenderThreads());
        this.tokenCodec = StringUtils.isEmpty(config.getTokenSecret()) ? null : new PendingTokenCodec(config.getTokenSecret());
        this.asyncHandler = tokenCodec == null ? null : new AsyncRenditionHandler(config, registry, scheduler, tokenCodec);
        this.janitor = new CacheJanitor(store.getRoot());
        this.maintenance = maintenance;
        this.resolver = new ImageRefResolver(this);

        maintenance.register(CACHE_SWEEP_TASK, () -> cleanCache(config.getCacheMaxAge()), config.getCacheSweepInterval());
        if (tokenCodec == null) {
            log.warn("No token secret configured; pending renditions cannot be served asynchronously");
        }
    }

    public RenditionConfig getConfig() {
        return config;
    }

    public SourceImageRegistry getRegistry() {
        return registry;
    }

    public RenderScheduler getScheduler() {
        return scheduler;
    }

    /**
     * @throws IllegalStateException if no token secret is configured
     */
    public AsyncRenditionHandler getAsyncHandler() {
        if (asyncHandler == null) {
            throw new IllegalStateException("Async renditions need renditions.token-secret to be set");
        }
        return asyncHandler;
    }

    /**
     * Find an image by reference; see {@link ImageRefResolver#resolve(String, List)}.
     */
    public ImageRef getImage(String path, List<Path> searchPath) {
        return resolver.resolve(path, searchPath);
    }

    /**
     * The file behind an asset URL handed out by {@link #getImage}, given the part of the URL after the asset path.
     */
    public Optional<Path> findAsset(String name) {
        return resolver.findAsset(name);
    }

    /**
     * The URL of a rendition: the cache URL if it already exists, otherwise an async endpoint URL that renders it
     * on request. Does not queue any work.
     */
    public Rendition getRendition(SourceImage source, RenditionSpec spec, double outputScale) {
        return toRendition(source, spec, outputScale, scheduler.ensureRendition(source, spec, outputScale, false));
    }

    /**
     * As {@link #getRendition}, but queues the render if the rendition does not exist yet.
     */
    public Rendition renderAsync(SourceImage source, RenditionSpec spec, double outputScale) {
        return toRendition(source, spec, outputScale, scheduler.ensureRendition(source, spec, outputScale, true));
    }

    private Rendition toRendition(SourceImage source, RenditionSpec spec, double outputScale, RenderStatus status) {
        if (!status.isPending()) {
            return new Rendition(staticUrl(status.getRelativePath()), status.getSize(), false);
        }
        if (tokenCodec == null) {
            throw new IllegalStateException("Async renditions need renditions.token-secret to be set");
        }
        String token = tokenCodec.encode(new PendingToken(source.getPath(), outputScale, spec));
        return new Rendition(asyncHandler.asyncUrl(token), status.getSize(), true);
    }

    public String staticUrl(String relativePath) {
        return config.getStaticUrlPath() + "/" + relativePath;
    }

    /** Queue a sweep of renditions unused for longer than {@code maxAge}. */
    public Future<?> cleanCache(Duration maxAge) {
        return janitor.schedule(scheduler, maxAge);
    }

    /**
     * Run the periodic maintenance tasks that are due.
     *
     * @return the number of tasks run
     */
    public int runMaintenance(boolean force) {
        return maintenance.run(force);
    }

    public boolean shutdown(long timeout, TimeUnit unit) {
        return scheduler.shutdown(timeout, unit);
    }
}
