package au.org.ala.renditions.render;

import au.org.ala.renditions.pipeline.EncodeOptions;
import au.org.ala.renditions.pipeline.ImageOperations;
import au.org.ala.renditions.spec.OutputFormat;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.plugins.jpeg.JPEGImageWriteParam;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;

/**
 * Writes a finished rendition in its output format, applying the encoder options.
 */
public class ImageEncoder {

    public byte[] encode(BufferedImage image, OutputFormat format, EncodeOptions options) throws IOException {
        BufferedImage prepared = prepare(image, format);

        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format.getFormatName());
        if (!writers.hasNext()) {
            throw new IOException("No ImageWriter for " + format.getFormatName());
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(bytes)) {
            writer.setOutput(ios);
            writer.write(null, new IIOImage(prepared, null, null), writeParam(writer, format, options));
            ios.flush();
        } finally {
            writer.dispose();
        }
        return bytes.toByteArray();
    }

    private ImageWriteParam writeParam(ImageWriter writer, OutputFormat format, EncodeOptions options) {
        ImageWriteParam param = writer.getDefaultWriteParam();
        if (format == OutputFormat.JPEG) {
            if (options.getQuality().isPresent() && param.canWriteCompressed()) {
                param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                param.setCompressionQuality(options.getQuality().get());
            }
            if (options.isOptimize() && param instanceof JPEGImageWriteParam) {
                ((JPEGImageWriteParam) param).setOptimizeHuffmanTables(true);
            }
        }
        return param;
    }

    private BufferedImage prepare(BufferedImage image, OutputFormat format) {
        if (!format.supportsTransparency() && image.getColorModel().hasAlpha()) {
            image = ImageOperations.flatten(image, Color.WHITE);
        }
        if (format.isPaletteRequired() && !(image.getColorModel() instanceof IndexColorModel)) {
            image = ImageOperations.quantize(image, 256);
        }
        if (format == OutputFormat.JPEG && image.getType() != BufferedImage.TYPE_INT_RGB
                && image.getType() != BufferedImage.TYPE_3BYTE_BGR) {
            image = ImageOperations.flatten(image, Color.WHITE);
        }
        return image;
    }
}
