package au.org.ala.renditions.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Keeps one {@link SourceImage} per absolute path, re-probing a file when its modification time moves past
 * the one recorded for it.
 */
public class SourceImageRegistry {

    private static final Logger log = LoggerFactory.getLogger(SourceImageRegistry.class);

    private final ImageProbe probe;
    private final ConcurrentMap<Path, SourceImage> images = new ConcurrentHashMap<>();

    public SourceImageRegistry(ImageProbe probe) {
        this.probe = probe;
    }

    public ImageProbe getProbe() {
        return probe;
    }

    /**
     * @return the source image at the path
     * @throws SourceNotFoundException if the file is missing or is not a decodable image
     */
    public SourceImage get(Path file) {
        Path key = file.toAbsolutePath().normalize();
        return find(key).orElseThrow(() -> new SourceNotFoundException(key.toString(), "Not an image: " + key));
    }

    /**
     * @return the source image at the path, or empty if the file exists but is not a decodable image
     * @throws SourceNotFoundException if the file is missing
     */
    public Optional<SourceImage> find(Path file) {
        Path key = file.toAbsolutePath().normalize();
        FileTime lastModified;
        try {
            lastModified = Files.getLastModifiedTime(key);
        } catch (IOException e) {
            images.remove(key);
            throw new SourceNotFoundException(key.toString());
        }
        if (!Files.isRegularFile(key)) {
            images.remove(key);
            throw new SourceNotFoundException(key.toString());
        }

        SourceImage current = images.get(key);
        if (isCurrent(current, lastModified)) {
            return Optional.of(current);
        }

        try {
            return Optional.ofNullable(images.compute(key, (path, existing) -> {
                if (isCurrent(existing, lastModified)) {
                    return existing;
                }
                log.info("Updating image {} (modified {})", path, lastModified);
                try {
                    return probe.probe(path).orElse(null);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }));
        } catch (UncheckedIOException e) {
            log.warn("Could not read source image {}", key, e.getCause());
            throw new SourceNotFoundException(key.toString(), "Could not read " + key + ": " + e.getCause().getMessage());
        }
    }

    private static boolean isCurrent(SourceImage image, FileTime lastModified) {
        return image != null && image.getLastModified().compareTo(lastModified) >= 0;
    }
}
