package au.org.ala.renditions.delivery;

import au.org.ala.renditions.RenditionConfig;
import au.org.ala.renditions.render.RenderScheduler;
import au.org.ala.renditions.render.RenderStatus;
import au.org.ala.renditions.source.SourceImage;
import au.org.ala.renditions.source.SourceImageRegistry;
import au.org.ala.renditions.source.SourceNotFoundException;
import au.org.ala.renditions.spec.InvalidSpecException;
import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Serves the async rendition endpoint.
 * <p>
 * A request names either a plain static file or a signed {@link PendingToken}. Pending renditions are polled
 * by redirecting the client back to this endpoint with an incremented retry counter; once the retry limit is
 * reached a placeholder is served with a {@code Refresh} header so the page reloads itself later.
 */
public class AsyncRenditionHandler {

    private static final Logger log = LoggerFactory.getLogger(AsyncRenditionHandler.class);

    public static final String RETRY_COUNT_PARAM = "retry_count";
    public static final String CACHE_BUST_PARAM = "cb";
    public static final String REFRESH_HEADER = "Refresh";

    private final RenditionConfig config;
    private final SourceImageRegistry registry;
    private final RenderScheduler scheduler;
    private final PendingTokenCodec codec;

    public AsyncRenditionHandler(RenditionConfig config, SourceImageRegistry registry, RenderScheduler scheduler,
                                 PendingTokenCodec codec) {
        this.config = config;
        this.registry = registry;
        this.scheduler = scheduler;
        this.codec = codec;
    }

    /** The endpoint URL for a token or static file name, without query parameters */
    public String asyncUrl(String renderSpecOrFilename) {
        return config.getAsyncUrlPath() + "/" + renderSpecOrFilename;
    }

    public AsyncResponse handle(String renderSpecOrFilename, int retryCount) {
        Path staticFile = staticFile(renderSpecOrFilename);
        if (staticFile != null) {
            return AsyncResponse.redirect(config.getStaticUrlPath() + "/" + renderSpecOrFilename);
        }

        PendingToken token;
        try {
            token = codec.decode(renderSpecOrFilename);
        } catch (InvalidTokenException e) {
            log.warn("Rejected async rendition request: {}", e.getMessage());
            return AsyncResponse.error(AsyncResponse.BAD_REQUEST, "Invalid rendition token");
        }

        SourceImage source;
        try {
            source = registry.get(token.getSourcePath());
        } catch (SourceNotFoundException e) {
            log.warn("Async rendition for missing source {}", e.getPath());
            return AsyncResponse.error(AsyncResponse.NOT_FOUND, "Source image not found");
        }

        RenderStatus status;
        try {
            status = scheduler.ensureRendition(source, token.getSpec(), token.getOutputScale(), true);
        } catch (InvalidSpecException e) {
            // the source changed since the token was issued
            log.warn("Async rendition for {} no longer applies: {}", source.getPath(), e.getMessage());
            return AsyncResponse.error(AsyncResponse.BAD_REQUEST, "Rendition does not fit its source");
        }
        if (!status.isPending()) {
            log.debug("Rendition {} ready after {} retries", status.getRelativePath(), retryCount);
            return AsyncResponse.redirect(config.getStaticUrlPath() + "/" + status.getRelativePath());
        }

        if (retryCount < config.getAsyncRetryLimit()) {
            pause();
            String location = asyncUrl(renderSpecOrFilename)
                    + "?" + RETRY_COUNT_PARAM + "=" + (retryCount + 1)
                    + "&" + CACHE_BUST_PARAM + "=" + ThreadLocalRandom.current().nextInt(Integer.MAX_VALUE);
            log.debug("Rendition {} still pending, retry {}", status.getRelativePath(), retryCount + 1);
            return AsyncResponse.redirect(location);
        }

        log.debug("Rendition {} still pending after {} retries, serving placeholder", status.getRelativePath(), retryCount);
        return AsyncResponse.image(PlaceholderImages.placeholderPng(status.getRelativePath()), PlaceholderImages.CONTENT_TYPE,
                ImmutableMap.of(REFRESH_HEADER, Integer.toString(config.getPlaceholderRefreshSeconds()),
                        "Cache-Control", "no-store"));
    }

    private void pause() {
        long delay = config.getAsyncRetryDelayMillis();
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private Path staticFile(String name) {
        Path root = config.getStaticFolder().toAbsolutePath().normalize();
        try {
            Path resolved = safeJoin(root, name);
            return Files.isRegularFile(resolved) ? resolved : null;
        } catch (IOException | InvalidPathException e) {
            return null;
        }
    }

    /**
     * Path join that refuses to leave the root.
     */
    static Path safeJoin(Path root, String relative) throws IOException {
        Path resolved = root.resolve(relative).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new IOException("Path traversal attempt: " + relative);
        }
        return resolved;
    }
}
