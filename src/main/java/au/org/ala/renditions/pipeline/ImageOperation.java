package au.org.ala.renditions.pipeline;

import java.awt.image.BufferedImage;

@FunctionalInterface
public interface ImageOperation {

    ImageOperation IDENTITY = image -> image;

    BufferedImage apply(BufferedImage image);
}
