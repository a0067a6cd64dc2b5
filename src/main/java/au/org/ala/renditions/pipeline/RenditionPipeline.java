package au.org.ala.renditions.pipeline;

import au.org.ala.renditions.sizing.RenditionSize;
import au.org.ala.renditions.spec.OutputFormat;
import com.google.common.base.Joiner;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The ordered steps that produce a rendition, the encoder arguments, and the cache key derived from the
 * labels of the steps that are applied.
 */
public final class RenditionPipeline {

    private final List<PipelineStep> steps;
    private final OutputFormat format;
    private final RenditionSize size;
    private final EncodeOptions encodeOptions;

    public RenditionPipeline(List<PipelineStep> steps, OutputFormat format, RenditionSize size, EncodeOptions encodeOptions) {
        this.steps = ImmutableList.copyOf(steps);
        this.format = format;
        this.size = size;
        this.encodeOptions = encodeOptions;
    }

    public List<PipelineStep> getSteps() {
        return steps;
    }

    public OutputFormat getFormat() {
        return format;
    }

    /** The size of the rendition once every step has been applied */
    public RenditionSize getSize() {
        return size;
    }

    public EncodeOptions getEncodeOptions() {
        return encodeOptions;
    }

    public List<String> getLabels() {
        return steps.stream()
                .filter(PipelineStep::isLabeled)
                .map(PipelineStep::getLabel)
                .collect(Collectors.toList());
    }

    public String getCacheKey() {
        return Joiner.on('_').join(getLabels());
    }

    /** {@code <slug>_<fingerprint-suffix>_<labels>.<ext>} */
    public String getFileName() {
        return getCacheKey() + "." + format.getExtension();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("steps", steps)
                .add("format", format)
                .add("size", size)
                .add("encodeOptions", encodeOptions)
                .toString();
    }
}
