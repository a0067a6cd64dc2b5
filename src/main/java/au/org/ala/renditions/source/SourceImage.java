package au.org.ala.renditions.source;

import au.org.ala.renditions.spec.OutputFormat;
import com.google.common.base.MoreObjects;

import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A probed source image on the local filesystem. Identity is the absolute file path; the fingerprint is the
 * invalidation key for every rendition derived from it.
 */
public final class SourceImage {

    private final Path path;
    private final int width;
    private final int height;
    private final String fingerprint;
    private final boolean transparent;
    private final boolean paletted;
    private final Orientation orientation;
    private final OutputFormat sourceFormat;
    private final FileTime lastModified;

    // serialises decode/encode of this source
    private final ReentrantLock renderLock = new ReentrantLock();

    public SourceImage(Path path, int width, int height, String fingerprint, boolean transparent, boolean paletted,
                       Orientation orientation, OutputFormat sourceFormat, FileTime lastModified) {
        this.path = path.toAbsolutePath().normalize();
        this.width = width;
        this.height = height;
        this.fingerprint = Objects.requireNonNull(fingerprint);
        this.transparent = transparent;
        this.paletted = paletted;
        this.orientation = orientation != null ? orientation : Orientation.Normal;
        this.sourceFormat = sourceFormat;
        this.lastModified = lastModified;
    }

    public Path getPath() {
        return path;
    }

    /** Width once the orientation has been applied */
    public int getWidth() {
        return width;
    }

    /** Height once the orientation has been applied */
    public int getHeight() {
        return height;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public boolean isTransparent() {
        return transparent;
    }

    public boolean isPaletted() {
        return paletted;
    }

    public Orientation getOrientation() {
        return orientation;
    }

    /** The output format matching the source file, if it is one renditions can be written as. */
    public Optional<OutputFormat> getSourceFormat() {
        return Optional.ofNullable(sourceFormat);
    }

    public FileTime getLastModified() {
        return lastModified;
    }

    public ReentrantLock getRenderLock() {
        return renderLock;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("path", path)
                .add("width", width)
                .add("height", height)
                .add("fingerprint", fingerprint)
                .add("transparent", transparent)
                .add("paletted", paletted)
                .add("orientation", orientation)
                .toString();
    }
}
