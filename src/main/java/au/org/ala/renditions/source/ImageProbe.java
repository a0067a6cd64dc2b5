package au.org.ala.renditions.source;

import au.org.ala.renditions.spec.OutputFormat;
import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Metadata;
import com.drew.metadata.MetadataException;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.google.common.hash.Funnels;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.google.common.io.MoreFiles;
import org.apache.commons.imaging.Imaging;
import org.apache.commons.imaging.formats.jpeg.JpegImageMetadata;
import org.apache.commons.imaging.formats.tiff.constants.TiffTagConstants;
import org.apache.commons.io.FilenameUtils;
import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.NodeList;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataFormatImpl;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.ColorModel;
import java.awt.image.IndexColorModel;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Iterator;
import java.util.Optional;

/**
 * Reads the attributes of a source file that renditions depend on: size (after EXIF orientation), colour
 * model, and a content fingerprint salted with the rendition version.
 */
public class ImageProbe {

    private static final Logger log = LoggerFactory.getLogger(ImageProbe.class);

    private static final Tika TIKA = new Tika();

    private final int renditionVersion;

    public ImageProbe(int renditionVersion) {
        this.renditionVersion = renditionVersion;
    }

    /**
     * @return the probed image, or empty if the file is not an image that can be decoded
     * @throws IOException if the file cannot be read at all
     */
    public Optional<SourceImage> probe(Path file) throws IOException {
        String mimeType = TIKA.detect(file);
        if (mimeType == null || !mimeType.startsWith("image/")) {
            log.debug("{} detected as {}, not an image", file, mimeType);
            return Optional.empty();
        }

        FileTime lastModified = Files.getLastModifiedTime(file);
        String fingerprint = fingerprint(file);

        try (ImageInputStream iis = ImageIO.createImageInputStream(file.toFile())) {
            ImageReader reader;
            try {
                reader = ImageReaders.open(iis);
            } catch (IOException e) {
                log.info("Could not find a reader for {}: {}", file, e.getMessage());
                return Optional.empty();
            }
            try {
                int width = reader.getWidth(0);
                int height = reader.getHeight(0);

                ColorModel colorModel = colorModel(reader);
                boolean paletted = colorModel instanceof IndexColorModel;
                boolean transparent = paletted || (colorModel != null && colorModel.hasAlpha());

                Orientation orientation = findOrientation(file, reader);
                if (orientation.isFlipDimensions()) {
                    int swap = width;
                    width = height;
                    height = swap;
                }

                OutputFormat format = OutputFormat.fromExtension(FilenameUtils.getExtension(file.toString())).orElse(null);

                log.debug("Probed {}: {}x{} orientation={} transparent={} paletted={}",
                        file, width, height, orientation, transparent, paletted);
                return Optional.of(new SourceImage(file, width, height, fingerprint, transparent, paletted,
                        orientation, format, lastModified));
            } catch (IOException e) {
                log.info("Could not read image header of {}: {}", file, e.getMessage());
                return Optional.empty();
            } finally {
                reader.dispose();
            }
        }
    }

    /**
     * Hex encoded SHA-256 of the rendition version followed by the file bytes.
     */
    public String fingerprint(Path file) throws IOException {
        Hasher hasher = Hashing.sha256().newHasher();
        hasher.putInt(renditionVersion);
        try (OutputStream sink = Funnels.asOutputStream(hasher)) {
            MoreFiles.asByteSource(file).copyTo(sink);
        }
        return hasher.hash().toString();
    }

    private static ColorModel colorModel(ImageReader reader) throws IOException {
        ImageTypeSpecifier raw = reader.getRawImageType(0);
        if (raw != null) {
            return raw.getColorModel();
        }
        Iterator<ImageTypeSpecifier> types = reader.getImageTypes(0);
        return types.hasNext() ? types.next().getColorModel() : null;
    }

    private static Orientation findOrientation(Path file, ImageReader reader) {
        // prefer the drew noakes metadata reader, as it copes with the most EXIF variants
        try {
            Metadata metadata = ImageMetadataReader.readMetadata(file.toFile());
            for (ExifIFD0Directory exif : metadata.getDirectoriesOfType(ExifIFD0Directory.class)) {
                if (exif.containsTag(ExifIFD0Directory.TAG_ORIENTATION)) {
                    return Orientation.fromExifOrientation(exif.getInt(ExifIFD0Directory.TAG_ORIENTATION));
                }
            }
            return Orientation.Normal;
        } catch (ImageProcessingException | IOException | MetadataException e) {
            log.debug("metadata-extractor could not read orientation of {}", file, e);
        }

        try {
            var metadata = Imaging.getMetadata(file.toFile());
            if (metadata instanceof JpegImageMetadata) {
                var field = ((JpegImageMetadata) metadata).findExifValueWithExactMatch(TiffTagConstants.TIFF_TAG_ORIENTATION);
                if (field != null) {
                    return Orientation.fromExifOrientation(field.getIntValue());
                }
            }
        } catch (Exception e) {
            log.debug("commons-imaging could not read orientation of {}", file, e);
        }

        try {
            return findImageOrientation(reader.getImageMetadata(0));
        } catch (IOException e) {
            log.debug("ImageIO could not read metadata of {}", file, e);
        }
        return Orientation.Normal;
    }

    private static Orientation findImageOrientation(IIOMetadata metadata) {
        if (metadata == null || !metadata.isStandardMetadataFormatSupported()) {
            return Orientation.Normal;
        }
        IIOMetadataNode root = (IIOMetadataNode) metadata.getAsTree(IIOMetadataFormatImpl.standardMetadataFormatName);
        NodeList imageOrientations = root.getElementsByTagName("ImageOrientation");
        if (imageOrientations != null && imageOrientations.getLength() > 0) {
            IIOMetadataNode imageOrientation = (IIOMetadataNode) imageOrientations.item(0);
            return Orientation.fromMetadataOrientation(imageOrientation.getAttribute("value"));
        }
        return Orientation.Normal;
    }
}
