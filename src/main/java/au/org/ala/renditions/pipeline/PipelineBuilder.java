package au.org.ala.renditions.pipeline;

import au.org.ala.renditions.sizing.CropBox;
import au.org.ala.renditions.sizing.RenditionSize;
import au.org.ala.renditions.sizing.SizePlan;
import au.org.ala.renditions.sizing.SizePlanner;
import au.org.ala.renditions.source.Orientation;
import au.org.ala.renditions.source.SourceImage;
import au.org.ala.renditions.spec.BackgroundColor;
import au.org.ala.renditions.spec.OutputFormat;
import au.org.ala.renditions.spec.RenditionSpec;
import au.org.ala.renditions.spec.ScaleFilter;
import com.google.common.base.Joiner;
import org.apache.commons.io.FilenameUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns a source image and a spec into a {@link RenditionPipeline}.
 * <p>
 * Steps are always assembled in the same order so that the cache key only depends on what is applied:
 * seed, orientation, colour model, flatten, crop/resize, quantize, quality.
 */
public class PipelineBuilder {

    private static final Pattern SLUG_SEPARATORS = Pattern.compile("[^a-zA-Z0-9.]+");
    private static final int FINGERPRINT_SUFFIX_LENGTH = 10;
    private static final int DEFAULT_PALETTE_SIZE = 256;

    private final SizePlanner sizePlanner;
    private final ScaleFilter defaultScaleFilter;

    public PipelineBuilder(SizePlanner sizePlanner, ScaleFilter defaultScaleFilter) {
        this.sizePlanner = sizePlanner;
        this.defaultScaleFilter = defaultScaleFilter;
    }

    public RenditionPipeline build(SourceImage source, RenditionSpec spec, double outputScale) {
        OutputFormat format = spec.getFormat()
                .orElse(source.getSourceFormat().orElse(source.isTransparent() ? OutputFormat.PNG : OutputFormat.JPEG));

        List<PipelineStep> steps = new ArrayList<>();

        // 1. filename seed
        steps.add(new PipelineStep(seed(source), ImageOperation.IDENTITY));

        // 2. orientation; always applied, and fixed by the source
        Orientation orientation = source.getOrientation();
        if (orientation != Orientation.Normal) {
            steps.add(PipelineStep.unlabeled(orientation::apply));
        }

        // 3. colour model
        boolean paletted = source.isPaletted();
        steps.add(PipelineStep.unlabeled(ImageOperations::toDirectColor));

        // 4. flatten transparency
        BackgroundColor background = spec.getBackground().orElse(null);
        if ((source.isTransparent() && !format.supportsTransparency()) || background != null) {
            BackgroundColor color = background != null ? background : BackgroundColor.WHITE;
            steps.add(new PipelineStep("b" + color.label(), image -> ImageOperations.flatten(image, color.toColor())));
        }

        // 5. crop and resize
        SizePlan plan = sizePlanner.plan(source.getWidth(), source.getHeight(), spec, outputScale);
        RenditionSize size = plan.getSize();
        CropBox box = plan.getBox().orElse(null);
        if (box != null || size.width != source.getWidth() || size.height != source.getHeight()) {
            List<String> parts = new ArrayList<>();
            parts.add(size.label());
            if (box != null) {
                parts.add(box.label());
            }
            spec.getScaleFilter().ifPresent(f -> parts.add(f.label()));
            ScaleFilter filter = spec.getScaleFilter().orElse(defaultScaleFilter);
            steps.add(new PipelineStep(Joiner.on('_').join(parts),
                    image -> ImageOperations.cropAndResize(image, box, size, filter)));
        }

        // 6. palette
        Integer quantize = spec.getQuantize().orElse(null);
        if (format.isPaletteCapable() && (paletted || format.isPaletteRequired() || quantize != null)) {
            int colors = quantize != null ? quantize : DEFAULT_PALETTE_SIZE;
            steps.add(new PipelineStep(quantize != null ? "p" + quantize : "",
                    image -> ImageOperations.quantize(image, colors)));
        }

        // 7. lossless / quality, applied by the encoder
        Float quality = null;
        if (format.supportsQuality()) {
            if (spec.isLossless()) {
                quality = 1.0f;
                steps.add(new PipelineStep("l", ImageOperation.IDENTITY));
            } else if (spec.getQuality().isPresent()) {
                int q = spec.getQuality().get();
                quality = q / 100.0f;
                steps.add(new PipelineStep("q" + q, ImageOperation.IDENTITY));
            }
        }
        boolean optimize = format == OutputFormat.JPEG || format == OutputFormat.PNG;

        return new RenditionPipeline(steps, format, size, new EncodeOptions(quality, optimize));
    }

    static String seed(SourceImage source) {
        String basename = FilenameUtils.getBaseName(source.getPath().getFileName().toString());
        String slug = SLUG_SEPARATORS.matcher(basename).replaceAll(" ").trim().replace(' ', '-');
        if (slug.isEmpty()) {
            slug = "image";
        }
        String fingerprint = source.getFingerprint();
        return slug + "_" + fingerprint.substring(Math.max(0, fingerprint.length() - FINGERPRINT_SUFFIX_LENGTH));
    }
}
