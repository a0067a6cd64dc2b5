package au.org.ala.renditions.sizing;

import au.org.ala.renditions.spec.CropRect;
import au.org.ala.renditions.spec.InvalidSpecException;
import au.org.ala.renditions.spec.RenditionSpec;

/**
 * Computes the output size and source crop box of a rendition. Pure arithmetic, no I/O.
 * <p>
 * All rounding is half-up ({@link Math#round(double)}) and no computed dimension is ever less than 1px.
 */
public class SizePlanner {

    public static final SizePlanner INSTANCE = new SizePlanner();

    /**
     * @param sourceWidth  the width of the source image, after orientation correction
     * @param sourceHeight the height of the source image, after orientation correction
     * @param spec         the rendition spec
     * @param outputScale  the pixel density multiplier of the output (1 for standard, 2 for hidpi)
     * @return the output size and, if part of the source is discarded, the box to take it from
     */
    public SizePlan plan(int sourceWidth, int sourceHeight, RenditionSpec spec, double outputScale) {
        if (sourceWidth <= 0 || sourceHeight <= 0) {
            throw new IllegalArgumentException("Source dimensions must be positive");
        }
        if (!(outputScale > 0)) {
            throw new InvalidSpecException("Output scale must be positive: " + outputScale);
        }

        CropRect crop = spec.getCrop().map(c -> intersect(c, sourceWidth, sourceHeight)).orElse(null);
        int inputW = crop != null ? crop.width : sourceWidth;
        int inputH = crop != null ? crop.height : sourceHeight;

        double[] working = prescale(spec, inputW, inputH);

        SizePlan plan;
        switch (spec.getResize()) {
            case FIT:
                plan = fit(spec, working[0], working[1], inputW, inputH, outputScale);
                break;
            case FILL:
                plan = fill(spec, working[0], working[1], inputW, inputH, outputScale);
                break;
            case STRETCH:
                plan = stretch(spec, working[0], working[1], outputScale);
                break;
            default:
                throw new InvalidSpecException("Unknown resize mode " + spec.getResize());
        }

        if (crop == null) {
            return plan;
        }
        CropBox box = plan.getBox()
                .map(b -> b.offset(crop.x, crop.y))
                .orElse(new CropBox(crop.x, crop.y, crop.x + crop.width, crop.y + crop.height));
        return new SizePlan(plan.getSize(), box);
    }

    private static CropRect intersect(CropRect crop, int sourceWidth, int sourceHeight) {
        if (crop.x >= sourceWidth || crop.y >= sourceHeight) {
            throw new InvalidSpecException("Crop rectangle " + crop.canonical() + " lies outside a "
                    + sourceWidth + "x" + sourceHeight + " source");
        }
        int w = Math.min(crop.width, sourceWidth - crop.x);
        int h = Math.min(crop.height, sourceHeight - crop.y);
        return (w == crop.width && h == crop.height) ? crop : new CropRect(crop.x, crop.y, w, h);
    }

    // scale divisor, then minimum floors which keep the aspect ratio
    private static double[] prescale(RenditionSpec spec, double width, double height) {
        if (spec.getScale().isPresent()) {
            width = width / spec.getScale().get();
            height = height / spec.getScale().get();
        }

        Integer minWidth = spec.getScaleMinWidth().orElse(null);
        if (minWidth != null && width < minWidth) {
            height = height * minWidth / width;
            width = minWidth;
        }

        Integer minHeight = spec.getScaleMinHeight().orElse(null);
        if (minHeight != null && height < minHeight) {
            width = width * minHeight / height;
            height = minHeight;
        }
        return new double[] { width, height };
    }

    private static SizePlan fit(RenditionSpec spec, double width, double height, int inputW, int inputH, double outputScale) {
        Integer[] widthLimits = { spec.getWidth().orElse(null), spec.getMaxWidth().orElse(null) };
        Integer[] heightLimits = { spec.getHeight().orElse(null), spec.getMaxHeight().orElse(null) };

        for (int i = 0; i < 2; i++) {
            Integer tgtWidth = widthLimits[i];
            if (tgtWidth != null && width > tgtWidth) {
                height = height * tgtWidth / width;
                width = tgtWidth;
            }
            Integer tgtHeight = heightLimits[i];
            if (tgtHeight != null && height > tgtHeight) {
                width = width * tgtHeight / height;
                height = tgtHeight;
            }
        }

        width = width * outputScale;
        height = height * outputScale;

        // never larger than the base image
        int w = Math.min(round(width), inputW);
        int h = Math.min(round(height), inputH);
        return new SizePlan(new RenditionSize(w, h), null);
    }

    private static SizePlan fill(RenditionSpec spec, double width, double height, int inputW, int inputH, double outputScale) {
        if (spec.getWidth().isPresent()) width = Math.min(width, spec.getWidth().get());
        if (spec.getMaxWidth().isPresent()) width = Math.min(width, spec.getMaxWidth().get());
        if (spec.getHeight().isPresent()) height = Math.min(height, spec.getHeight().get());
        if (spec.getMaxHeight().isPresent()) height = Math.min(height, spec.getMaxHeight().get());

        width = width * outputScale;
        height = height * outputScale;

        // never larger than the base image, keeping the output aspect
        if (width > inputW) {
            height = height * inputW / width;
            width = inputW;
        }
        if (height > inputH) {
            width = width * inputH / height;
            height = inputH;
        }

        int boxW = Math.max(1, Math.min(inputW, round(width * inputH / height)));
        int boxH = Math.max(1, Math.min(inputH, round(height * inputW / width)));
        int boxX = (int) Math.round((inputW - boxW) * spec.getFillCropX());
        int boxY = (int) Math.round((inputH - boxH) * spec.getFillCropY());

        return new SizePlan(
                new RenditionSize(round(width), round(height)),
                new CropBox(boxX, boxY, boxX + boxW, boxY + boxH));
    }

    private static SizePlan stretch(RenditionSpec spec, double width, double height, double outputScale) {
        if (spec.getWidth().isPresent() && width > spec.getWidth().get()) width = spec.getWidth().get();
        if (spec.getHeight().isPresent() && height > spec.getHeight().get()) height = spec.getHeight().get();
        if (spec.getMaxWidth().isPresent() && width > spec.getMaxWidth().get()) width = spec.getMaxWidth().get();
        if (spec.getMaxHeight().isPresent() && height > spec.getMaxHeight().get()) height = spec.getMaxHeight().get();

        return new SizePlan(new RenditionSize(round(width * outputScale), round(height * outputScale)), null);
    }

    private static int round(double v) {
        try {
            return Math.toIntExact(Math.max(1, Math.round(v)));
        } catch (ArithmeticException e) {
            throw new InvalidSpecException("Rendition dimension out of range: " + v);
        }
    }
}
