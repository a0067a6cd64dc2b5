package au.org.ala.renditions.source;

import org.imgscalr.Scalr;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * EXIF orientations, as defined by the TIFF {@code Orientation} tag, with the rotations that bring the
 * 0th row to the visual top and the 0th column to the visual left.
 */
public enum Orientation {
    Normal(1, false, List.of()),
    FlipH(2, false, List.of(Scalr.Rotation.FLIP_HORZ)),
    Rotate180(3, false, List.of(Scalr.Rotation.CW_180)),
    FlipV(4, false, List.of(Scalr.Rotation.FLIP_VERT)),
    FlipVRotate90(5, true, List.of(Scalr.Rotation.FLIP_VERT, Scalr.Rotation.CW_90)),
    Rotate270(6, true, List.of(Scalr.Rotation.CW_90)),
    FlipHRotate90(7, true, List.of(Scalr.Rotation.FLIP_HORZ, Scalr.Rotation.CW_90)),
    Rotate90(8, true, List.of(Scalr.Rotation.CW_270));

    private final int value; // value as defined in TIFF spec
    private final boolean flipDimensions;
    private final List<Scalr.Rotation> rotations;

    Orientation(int value, boolean flipDimensions, List<Scalr.Rotation> rotations) {
        this.value = value;
        this.flipDimensions = flipDimensions;
        this.rotations = rotations;
    }

    public int value() {
        return value;
    }

    /** Whether width and height swap once the orientation is applied */
    public boolean isFlipDimensions() {
        return flipDimensions;
    }

    public BufferedImage apply(BufferedImage image) {
        BufferedImage result = image;
        for (Scalr.Rotation rotation : rotations) {
            BufferedImage rotated = Scalr.rotate(result, rotation);
            if (result != image) {
                result.flush();
            }
            result = rotated;
        }
        return result;
    }

    public static Orientation fromExifOrientation(final int orientation) {
        for (Orientation o : values()) {
            if (o.value == orientation) {
                return o;
            }
        }
        return Normal;
    }

    /**
     * @param orientationName the {@code value} of a javax.imageio standard metadata {@code ImageOrientation} node
     */
    public static Orientation fromMetadataOrientation(final String orientationName) {
        if (orientationName != null) {
            for (Orientation orientation : values()) {
                if (orientation.name().equalsIgnoreCase(orientationName)) {
                    return orientation;
                }
            }
        }
        return Normal;
    }
}
