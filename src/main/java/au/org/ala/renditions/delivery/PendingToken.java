package au.org.ala.renditions.delivery;

import au.org.ala.renditions.spec.RenditionSpec;
import com.google.common.base.MoreObjects;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Everything needed to resume a deferred rendition request: the source file, the output scale and the spec.
 */
public final class PendingToken {

    private final Path sourcePath;
    private final double outputScale;
    private final RenditionSpec spec;

    public PendingToken(Path sourcePath, double outputScale, RenditionSpec spec) {
        this.sourcePath = sourcePath.toAbsolutePath().normalize();
        this.outputScale = outputScale;
        this.spec = Objects.requireNonNull(spec);
    }

    public Path getSourcePath() {
        return sourcePath;
    }

    public double getOutputScale() {
        return outputScale;
    }

    public RenditionSpec getSpec() {
        return spec;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PendingToken)) return false;
        PendingToken that = (PendingToken) o;
        return Double.compare(that.outputScale, outputScale) == 0
                && sourcePath.equals(that.sourcePath)
                && spec.equals(that.spec);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourcePath, outputScale, spec);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("sourcePath", sourcePath)
                .add("outputScale", outputScale)
                .add("spec", spec.canonical())
                .toString();
    }
}
