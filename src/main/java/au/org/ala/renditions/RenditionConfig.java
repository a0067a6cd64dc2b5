package au.org.ala.renditions;

import au.org.ala.renditions.spec.ScaleFilter;
import com.google.common.base.MoreObjects;
import com.google.common.io.ByteSource;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;

/**
 * Settings for the rendition service. Defaults are usable as-is except for the token secret, which must be set
 * before pending tokens can be issued.
 */
public class RenditionConfig {

    public static final String PREFIX = "renditions.";

    private Path _staticFolder = Paths.get("static");
    private String _staticUrlPath = "/static";
    private String _outputSubdir = "_img";
    private Path _contentFolder = Paths.get("content");
    private int _renderThreads = Runtime.getRuntime().availableProcessors();
    private Duration _cacheMaxAge = Duration.ofDays(30);
    private Duration _cacheSweepInterval = Duration.ofHours(1);
    private ScaleFilter _defaultScaleFilter = ScaleFilter.LANCZOS;
    private String _tokenSecret;
    private String _asyncUrlPath = "/_async";
    private String _assetUrlPath = "/_file";
    private int _asyncRetryLimit = 10;
    private long _asyncRetryDelayMillis = 250;
    private int _placeholderRefreshSeconds = 5;
    private int _renditionVersion = 1;

    public RenditionConfig() {
    }

    public static RenditionConfig load(ByteSource source) throws IOException {
        Properties properties = new Properties();
        try (InputStream is = source.openBufferedStream()) {
            properties.load(is);
        }
        return fromProperties(properties);
    }

    /**
     * Read {@code renditions.*} keys; anything missing keeps its default.
     *
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static RenditionConfig fromProperties(Properties properties) {
        RenditionConfig config = new RenditionConfig();
        String v;
        if ((v = get(properties, "static-folder")) != null) config.setStaticFolder(Paths.get(v));
        if ((v = get(properties, "static-url-path")) != null) config.setStaticUrlPath(v);
        if ((v = get(properties, "output-subdir")) != null) config.setOutputSubdir(v);
        if ((v = get(properties, "content-folder")) != null) config.setContentFolder(Paths.get(v));
        if ((v = get(properties, "render-threads")) != null) config.setRenderThreads(parseInt("render-threads", v));
        if ((v = get(properties, "cache-max-age")) != null) config.setCacheMaxAge(Duration.ofSeconds(parseLong("cache-max-age", v)));
        if ((v = get(properties, "cache-sweep-interval")) != null) config.setCacheSweepInterval(Duration.ofSeconds(parseLong("cache-sweep-interval", v)));
        if ((v = get(properties, "default-scale-filter")) != null) config.setDefaultScaleFilter(ScaleFilter.parse(v));
        if ((v = get(properties, "token-secret")) != null) config.setTokenSecret(v);
        if ((v = get(properties, "async-url-path")) != null) config.setAsyncUrlPath(v);
        if ((v = get(properties, "asset-url-path")) != null) config.setAssetUrlPath(v);
        if ((v = get(properties, "async-retry-limit")) != null) config.setAsyncRetryLimit(parseInt("async-retry-limit", v));
        if ((v = get(properties, "async-retry-delay-ms")) != null) config.setAsyncRetryDelayMillis(parseLong("async-retry-delay-ms", v));
        if ((v = get(properties, "placeholder-refresh-seconds")) != null) config.setPlaceholderRefreshSeconds(parseInt("placeholder-refresh-seconds", v));
        if ((v = get(properties, "rendition-version")) != null) config.setRenditionVersion(parseInt("rendition-version", v));
        return config;
    }

    private static String get(Properties properties, String key) {
        return StringUtils.trimToNull(properties.getProperty(PREFIX + key));
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + PREFIX + key + ": " + value, e);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + PREFIX + key + ": " + value, e);
        }
    }

    /** Root of the public static files; renditions are written beneath it */
    public Path getStaticFolder() { return _staticFolder; }
    public void setStaticFolder(Path staticFolder) { _staticFolder = staticFolder; }

    public String getStaticUrlPath() { return _staticUrlPath; }
    public void setStaticUrlPath(String staticUrlPath) { _staticUrlPath = StringUtils.removeEnd(staticUrlPath, "/"); }

    public String getOutputSubdir() { return _outputSubdir; }
    public void setOutputSubdir(String outputSubdir) { _outputSubdir = outputSubdir; }

    public Path getContentFolder() { return _contentFolder; }
    public void setContentFolder(Path contentFolder) { _contentFolder = contentFolder; }

    public int getRenderThreads() { return _renderThreads; }
    public void setRenderThreads(int renderThreads) {
        if (renderThreads < 1) {
            throw new IllegalArgumentException("render-threads must be at least 1");
        }
        _renderThreads = renderThreads;
    }

    public Duration getCacheMaxAge() { return _cacheMaxAge; }
    public void setCacheMaxAge(Duration cacheMaxAge) { _cacheMaxAge = cacheMaxAge; }

    public Duration getCacheSweepInterval() { return _cacheSweepInterval; }
    public void setCacheSweepInterval(Duration cacheSweepInterval) { _cacheSweepInterval = cacheSweepInterval; }

    public ScaleFilter getDefaultScaleFilter() { return _defaultScaleFilter; }
    public void setDefaultScaleFilter(ScaleFilter defaultScaleFilter) { _defaultScaleFilter = defaultScaleFilter; }

    public String getTokenSecret() { return _tokenSecret; }
    public void setTokenSecret(String tokenSecret) { _tokenSecret = tokenSecret; }

    public String getAsyncUrlPath() { return _asyncUrlPath; }
    public void setAsyncUrlPath(String asyncUrlPath) { _asyncUrlPath = StringUtils.removeEnd(asyncUrlPath, "/"); }

    public String getAssetUrlPath() { return _assetUrlPath; }
    public void setAssetUrlPath(String assetUrlPath) { _assetUrlPath = StringUtils.removeEnd(assetUrlPath, "/"); }

    public int getAsyncRetryLimit() { return _asyncRetryLimit; }
    public void setAsyncRetryLimit(int asyncRetryLimit) { _asyncRetryLimit = asyncRetryLimit; }

    public long getAsyncRetryDelayMillis() { return _asyncRetryDelayMillis; }
    public void setAsyncRetryDelayMillis(long asyncRetryDelayMillis) { _asyncRetryDelayMillis = asyncRetryDelayMillis; }

    public int getPlaceholderRefreshSeconds() { return _placeholderRefreshSeconds; }
    public void setPlaceholderRefreshSeconds(int placeholderRefreshSeconds) { _placeholderRefreshSeconds = placeholderRefreshSeconds; }

    /** Salted into every fingerprint; bump it to invalidate all renditions */
    public int getRenditionVersion() { return _renditionVersion; }
    public void setRenditionVersion(int renditionVersion) { _renditionVersion = renditionVersion; }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("staticFolder", _staticFolder)
                .add("staticUrlPath", _staticUrlPath)
                .add("outputSubdir", _outputSubdir)
                .add("contentFolder", _contentFolder)
                .add("renderThreads", _renderThreads)
                .add("cacheMaxAge", _cacheMaxAge)
                .add("cacheSweepInterval", _cacheSweepInterval)
                .add("defaultScaleFilter", _defaultScaleFilter)
                .add("asyncUrlPath", _asyncUrlPath)
                .add("asyncRetryLimit", _asyncRetryLimit)
                .toString();
    }
}
