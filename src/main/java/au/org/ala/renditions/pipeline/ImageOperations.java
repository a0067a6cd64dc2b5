package au.org.ala.renditions.pipeline;

import au.org.ala.renditions.sizing.CropBox;
import au.org.ala.renditions.sizing.RenditionSize;
import au.org.ala.renditions.spec.ScaleFilter;
import com.twelvemonkeys.image.ImageUtil;
import com.twelvemonkeys.image.ResampleOp;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

/**
 * The pixel transformations a rendition pipeline is assembled from.
 */
public final class ImageOperations {

    private ImageOperations() {
    }

    /**
     * Expand paletted and other non-standard images to packed RGB / ARGB so the later steps have a colour
     * model they can work in.
     */
    public static BufferedImage toDirectColor(BufferedImage image) {
        switch (image.getType()) {
            case BufferedImage.TYPE_INT_RGB:
            case BufferedImage.TYPE_INT_ARGB:
            case BufferedImage.TYPE_3BYTE_BGR:
            case BufferedImage.TYPE_4BYTE_ABGR:
                return image;
            default:
                int type = image.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
                return redraw(image, type, null);
        }
    }

    /**
     * Paint the image over a solid background, dropping the alpha channel.
     */
    public static BufferedImage flatten(BufferedImage image, Color background) {
        Color opaque = new Color(background.getRed(), background.getGreen(), background.getBlue());
        return redraw(image, BufferedImage.TYPE_INT_RGB, opaque);
    }

    /**
     * Crop the image to the box (if any) and resample the result to exactly the target size.
     */
    public static BufferedImage cropAndResize(BufferedImage image, CropBox box, RenditionSize size, ScaleFilter filter) {
        BufferedImage region = image;
        if (box != null) {
            int left = clamp(box.left, 0, image.getWidth() - 1);
            int top = clamp(box.top, 0, image.getHeight() - 1);
            int right = clamp(box.right, left + 1, image.getWidth());
            int bottom = clamp(box.bottom, top + 1, image.getHeight());
            region = image.getSubimage(left, top, right - left, bottom - top);
        }
        if (region.getWidth() == size.width && region.getHeight() == size.height) {
            return region;
        }
        return new ResampleOp(size.width, size.height, filter.getResampleFilter()).filter(region, null);
    }

    /**
     * Reduce the image to an indexed palette of at most {@code colors} entries.
     */
    public static BufferedImage quantize(BufferedImage image, int colors) {
        int hints = ImageUtil.DITHER_DIFFUSION | ImageUtil.COLOR_SELECTION_QUALITY
                | (image.getColorModel().hasAlpha() ? ImageUtil.TRANSPARENCY_BITMASK : ImageUtil.TRANSPARENCY_OPAQUE);
        return ImageUtil.createIndexed(image, colors, null, hints);
    }

    private static BufferedImage redraw(BufferedImage image, int type, Color background) {
        BufferedImage out = new BufferedImage(image.getWidth(), image.getHeight(), type);
        Graphics2D g = out.createGraphics();
        try {
            if (background != null) {
                g.setColor(background);
                g.fillRect(0, 0, image.getWidth(), image.getHeight());
            }
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    private static int clamp(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }
}
