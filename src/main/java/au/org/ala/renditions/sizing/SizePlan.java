package au.org.ala.renditions.sizing;

import com.google.common.base.MoreObjects;

import java.util.Optional;

/**
 * The output size of a rendition and, where part of the source is discarded, the source box to take it from.
 */
public final class SizePlan {

    private final RenditionSize size;
    private final CropBox box;

    public SizePlan(RenditionSize size, CropBox box) {
        this.size = size;
        this.box = box;
    }

    public RenditionSize getSize() {
        return size;
    }

    public Optional<CropBox> getBox() {
        return Optional.ofNullable(box);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("size", size)
                .add("box", box)
                .toString();
    }
}
