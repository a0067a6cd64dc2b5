package au.org.ala.renditions.pipeline;

/**
 * A named transformation. Steps with an empty label do not contribute to the cache key: their effect is
 * fully determined by the source image itself.
 */
public final class PipelineStep {

    private final String label;
    private final ImageOperation operation;

    public PipelineStep(String label, ImageOperation operation) {
        this.label = label == null ? "" : label;
        this.operation = operation;
    }

    public static PipelineStep unlabeled(ImageOperation operation) {
        return new PipelineStep("", operation);
    }

    public String getLabel() {
        return label;
    }

    public boolean isLabeled() {
        return !label.isEmpty();
    }

    public ImageOperation getOperation() {
        return operation;
    }

    @Override
    public String toString() {
        return isLabeled() ? label : "<unlabeled>";
    }
}
