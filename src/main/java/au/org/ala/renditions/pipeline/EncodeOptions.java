package au.org.ala.renditions.pipeline;

import com.google.common.base.MoreObjects;

import java.util.Optional;

/**
 * Encoder arguments. These affect how the final image is written, not its pixels.
 */
public final class EncodeOptions {

    private final Float quality;
    private final boolean optimize;

    public EncodeOptions(Float quality, boolean optimize) {
        this.quality = quality;
        this.optimize = optimize;
    }

    /** Compression quality in [0, 1], for formats that take one. */
    public Optional<Float> getQuality() {
        return Optional.ofNullable(quality);
    }

    public boolean isOptimize() {
        return optimize;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .omitNullValues()
                .add("quality", quality)
                .add("optimize", optimize)
                .toString();
    }
}
