package au.org.ala.renditions.source;

import au.org.ala.renditions.Rendition;
import au.org.ala.renditions.spec.RenditionSpec;

import java.util.Map;

/**
 * An image referenced from content, whatever kind it turned out to be.
 */
public interface ImageRef {

    SourceKind getKind();

    /**
     * @throws SourceNotFoundException for {@link SourceKind#MISSING} references
     */
    Rendition getRendition(RenditionSpec spec, double outputScale);

    /**
     * Attributes for an {@code img} element showing the image: {@code src}, and where known {@code width},
     * {@code height}, {@code srcset} and {@code style}.
     *
     * @throws SourceNotFoundException for {@link SourceKind#MISSING} references
     */
    Map<String, String> getImgAttrs(RenditionSpec spec);

    /** CSS declarations that set the image as an element background */
    String getCssBackground(RenditionSpec spec);
}
