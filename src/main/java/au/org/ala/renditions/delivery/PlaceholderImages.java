package au.org.ala.renditions.delivery;

import org.apache.commons.codec.digest.DigestUtils;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Tiny stand-in images for renditions that are not ready yet. The pixels are taken from a hash of the
 * requested name, so the same request always gets the same placeholder.
 */
public final class PlaceholderImages {

    public static final String CONTENT_TYPE = "image/png";

    private PlaceholderImages() {
    }

    /** A 2x2 image coloured from the first twelve bytes of the MD5 of {@code name} */
    public static BufferedImage placeholder(String name) {
        byte[] md5 = DigestUtils.md5(name.getBytes(StandardCharsets.UTF_8));
        BufferedImage image = new BufferedImage(2, 2, BufferedImage.TYPE_INT_RGB);
        for (int i = 0; i < 4; i++) {
            int r = md5[i * 3] & 0xff;
            int g = md5[i * 3 + 1] & 0xff;
            int b = md5[i * 3 + 2] & 0xff;
            image.setRGB(i % 2, i / 2, (r << 16) | (g << 8) | b);
        }
        return image;
    }

    public static byte[] placeholderPng(String name) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try {
            ImageIO.write(placeholder(name), "png", bytes);
        } catch (IOException e) {
            // in-memory stream
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }
}
