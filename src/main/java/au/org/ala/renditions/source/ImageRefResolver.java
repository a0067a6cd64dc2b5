package au.org.ala.renditions.source;

import au.org.ala.renditions.RenditionConfig;
import au.org.ala.renditions.RenditionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Works out what an image reference in content points at.
 * <ul>
 *     <li>{@code @path} is a file in the static folder</li>
 *     <li>{@code //host/...} or anything containing {@code ://} is a remote URL</li>
 *     <li>an absolute path is looked up relative to the content folder</li>
 *     <li>a relative path is looked up in each directory of the search path in turn</li>
 * </ul>
 * Files found on disk that cannot be decoded as images are served as plain assets; {@link #findAsset(String)} maps
 * their URL names back to the file.
 */
public class ImageRefResolver {

    private static final Logger log = LoggerFactory.getLogger(ImageRefResolver.class);

    private static final int ASSET_PREFIX_LENGTH = 5;

    private final RenditionService service;
    private final Map<String, Path> assets = new ConcurrentHashMap<>();

    public ImageRefResolver(RenditionService service) {
        this.service = service;
    }

    public ImageRef resolve(String path, List<Path> searchPath) {
        RenditionConfig config = service.getConfig();
        if (path.startsWith("@")) {
            return new ExternalImageRef(SourceKind.STATIC_ASSET, config.getStaticUrlPath() + "/" + path.substring(1));
        }
        if (path.startsWith("//") || path.contains("://")) {
            return new ExternalImageRef(SourceKind.REMOTE, path);
        }

        Optional<Path> file;
        if (path.startsWith("/")) {
            file = findFile(path.replaceFirst("^/+", ""), Collections.singletonList(config.getContentFolder()));
        } else {
            file = findFile(path, searchPath);
        }
        if (!file.isPresent()) {
            log.debug("Image {} not found in {}", path, searchPath);
            return new MissingImageRef(path);
        }

        try {
            Optional<SourceImage> source = service.getRegistry().find(file.get());
            if (source.isPresent()) {
                return new LocalImageRef(service, source.get());
            }
            return asset(config, file.get());
        } catch (SourceNotFoundException e) {
            // removed since the lookup
            return new MissingImageRef(path);
        }
    }

    private ImageRef asset(RenditionConfig config, Path file) {
        String fingerprint;
        try {
            fingerprint = service.getRegistry().getProbe().fingerprint(file);
        } catch (IOException e) {
            log.warn("Could not fingerprint asset {}", file, e);
            throw new SourceNotFoundException(file.toString(), "Could not read " + file);
        }
        String name = fingerprint.substring(0, ASSET_PREFIX_LENGTH) + "/" + file.getFileName();
        assets.put(name, file.toAbsolutePath().normalize());
        return new ExternalImageRef(SourceKind.STATIC_ASSET, config.getAssetUrlPath() + "/" + name);
    }

    /**
     * Look up a file previously handed out as an asset.
     *
     * @param name the part of the asset URL after the asset path, {@code <prefix>/<filename>}
     */
    public Optional<Path> findAsset(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Path file = assets.get(name.replaceFirst("^/+", ""));
        if (file == null || !Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(file);
    }

    static Optional<Path> findFile(String path, List<Path> searchPath) {
        if (searchPath == null) {
            return Optional.empty();
        }
        for (Path dir : searchPath) {
            try {
                Path candidate = dir.resolve(path).normalize();
                if (Files.isRegularFile(candidate)) {
                    return Optional.of(candidate);
                }
            } catch (InvalidPathException e) {
                log.debug("Invalid image path {}", path);
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
