package au.org.ala.renditions.cache;

import au.org.ala.renditions.render.RenderScheduler;
import com.google.common.base.Stopwatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Future;

/**
 * Deletes renditions that have not been requested for longer than a maximum age, then prunes the directories
 * left empty. The root directory itself is kept.
 * <p>
 * Cache hits refresh a rendition's modification time, so age here means time since last use.
 */
public class CacheJanitor {

    private static final Logger log = LoggerFactory.getLogger(CacheJanitor.class);

    private final Path root;
    private final Clock clock;

    public CacheJanitor(Path root) {
        this(root, Clock.systemUTC());
    }

    public CacheJanitor(Path root, Clock clock) {
        this.root = root.toAbsolutePath().normalize();
        this.clock = clock;
    }

    public Path getRoot() {
        return root;
    }

    /** Queue a sweep on the render pool. */
    public Future<?> schedule(RenderScheduler scheduler, Duration maxAge) {
        return scheduler.submit(() -> sweep(maxAge));
    }

    public SweepResult sweep(Duration maxAge) {
        if (!Files.isDirectory(root)) {
            log.debug("Rendition cache {} does not exist, nothing to sweep", root);
            return new SweepResult(0, 0, 0, 0);
        }
        Stopwatch sw = Stopwatch.createStarted();
        FileTime threshold = FileTime.from(clock.instant().minus(maxAge));
        Visitor visitor = new Visitor(threshold);
        try {
            Files.walkFileTree(root, visitor);
        } catch (IOException e) {
            log.warn("Sweep of {} stopped early", root, e);
            visitor.errors++;
        }
        SweepResult result = new SweepResult(visitor.deleted, visitor.removedDirs, visitor.retained, visitor.errors);
        log.info("Swept {} in {}: {}", root, sw, result);
        return result;
    }

    private final class Visitor extends SimpleFileVisitor<Path> {

        private final FileTime threshold;
        int deleted;
        int removedDirs;
        int retained;
        int errors;

        Visitor(FileTime threshold) {
            this.threshold = threshold;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (attrs.lastModifiedTime().compareTo(threshold) < 0) {
                try {
                    Files.delete(file);
                    deleted++;
                    log.info("Removing stale rendition {}", file);
                } catch (NoSuchFileException e) {
                    log.debug("{} already removed", file);
                } catch (IOException e) {
                    log.warn("Could not remove {}", file, e);
                    errors++;
                }
            } else {
                retained++;
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
            if (!(exc instanceof NoSuchFileException)) {
                log.warn("Skipping {}", file, exc);
                errors++;
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
            if (exc != null) {
                log.warn("Error while sweeping {}", dir, exc);
                errors++;
            }
            if (dir.equals(root)) {
                return FileVisitResult.CONTINUE;
            }
            try {
                if (isEmpty(dir)) {
                    Files.delete(dir);
                    removedDirs++;
                    log.debug("Removed empty directory {}", dir);
                }
            } catch (DirectoryNotEmptyException | NoSuchFileException e) {
                // a render landed in it, or another sweep got there first
                log.debug("Kept directory {}: {}", dir, e.toString());
            } catch (IOException e) {
                log.warn("Could not remove directory {}", dir, e);
                errors++;
            }
            return FileVisitResult.CONTINUE;
        }
    }

    private static boolean isEmpty(Path dir) throws IOException {
        try (var entries = Files.newDirectoryStream(dir)) {
            return !entries.iterator().hasNext();
        }
    }
}
