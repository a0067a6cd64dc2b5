package au.org.ala.renditions.source;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.IOException;
import java.util.Iterator;

/**
 * Chooses the ImageIO reader for a source, preferring the TwelveMonkeys plugins over the JDK ones.
 */
public final class ImageReaders {

    static {
        ImageIO.scanForPlugins();
        ImageIO.setUseCache(false);
    }

    private ImageReaders() {
    }

    public static ImageReader select(Iterator<ImageReader> candidates) {
        if (candidates == null) {
            return null;
        }
        ImageReader first = null;
        while (candidates.hasNext()) {
            ImageReader reader = candidates.next();
            if (first == null) {
                first = reader;
            }
            if (reader.getClass().getCanonicalName().contains("twelvemonkeys")) {
                return reader;
            }
        }
        return first;
    }

    /**
     * Select a reader for the stream and attach it, with metadata enabled.
     *
     * @throws IOException if no reader understands the stream
     */
    public static ImageReader open(ImageInputStream iis) throws IOException {
        if (iis == null) {
            throw new IOException("No ImageInputStream could be created for source image");
        }
        ImageReader reader = select(ImageIO.getImageReaders(iis));
        if (reader == null) {
            throw new IOException("No compatible ImageReader for source image");
        }
        reader.setInput(iis, true, false);
        return reader;
    }
}
