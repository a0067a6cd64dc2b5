package au.org.ala.renditions.store;

import au.org.ala.renditions.pipeline.PipelineBuilder;
import au.org.ala.renditions.pipeline.RenditionPipeline;
import au.org.ala.renditions.sizing.RenditionSize;
import au.org.ala.renditions.source.SourceImage;
import au.org.ala.renditions.spec.RenditionSpec;
import com.google.common.base.MoreObjects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

/**
 * Maps (source, spec, output scale) onto a deterministic location in the rendition cache.
 * <p>
 * Renditions live at {@code <static-folder>/<output-subdir>/<fp[0:2]>/<fp[2:6]>/<file name>}; the two
 * fingerprint shards bound the number of entries per directory.
 */
public class RenditionStore {

    private static final Logger log = LoggerFactory.getLogger(RenditionStore.class);

    private final Path staticFolder;
    private final String outputSubdir;
    private final PipelineBuilder pipelineBuilder;

    public RenditionStore(Path staticFolder, String outputSubdir, PipelineBuilder pipelineBuilder) {
        this.staticFolder = staticFolder.toAbsolutePath().normalize();
        this.outputSubdir = outputSubdir;
        this.pipelineBuilder = pipelineBuilder;
    }

    public Path getStaticFolder() {
        return staticFolder;
    }

    /** The directory every rendition is written beneath */
    public Path getRoot() {
        return staticFolder.resolve(outputSubdir);
    }

    public Resolution resolve(SourceImage source, RenditionSpec spec, double outputScale) {
        RenditionPipeline pipeline = pipelineBuilder.build(source, spec, outputScale);
        String fingerprint = source.getFingerprint();
        String relativePath = String.join("/",
                outputSubdir, fingerprint.substring(0, 2), fingerprint.substring(2, 6), pipeline.getFileName());
        Path path = staticFolder.resolve(relativePath);
        boolean exists = touch(path);
        return new Resolution(pipeline, path, relativePath, exists);
    }

    /**
     * Create the directory a rendition is written to. Safe to call from several threads at once.
     */
    public void prepare(Resolution resolution) throws IOException {
        Files.createDirectories(resolution.getPath().getParent());
    }

    public AtomicFileByteSink sinkFor(Resolution resolution) {
        return new AtomicFileByteSink(resolution.getPath());
    }

    /**
     * Mark the rendition as recently used so the janitor keeps it.
     *
     * @return true if the file exists
     */
    private boolean touch(Path path) {
        if (!Files.isRegularFile(path)) {
            return false;
        }
        try {
            Files.setLastModifiedTime(path, FileTime.fromMillis(System.currentTimeMillis()));
        } catch (NoSuchFileException e) {
            // swept between the check and the touch
            return false;
        } catch (IOException e) {
            log.debug("Could not refresh modification time of {}", path, e);
        }
        return true;
    }

    /**
     * Where a rendition lives, how it is produced and whether it is already on disk.
     */
    public static final class Resolution {

        private final RenditionPipeline pipeline;
        private final Path path;
        private final String relativePath;
        private final boolean exists;

        Resolution(RenditionPipeline pipeline, Path path, String relativePath, boolean exists) {
            this.pipeline = pipeline;
            this.path = path;
            this.relativePath = relativePath;
            this.exists = exists;
        }

        public RenditionPipeline getPipeline() {
            return pipeline;
        }

        public Path getPath() {
            return path;
        }

        /** Path relative to the static folder, always '/' separated */
        public String getRelativePath() {
            return relativePath;
        }

        public RenditionSize getSize() {
            return pipeline.getSize();
        }

        public boolean exists() {
            return exists;
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                    .add("relativePath", relativePath)
                    .add("size", getSize())
                    .add("exists", exists)
                    .toString();
        }
    }
}
