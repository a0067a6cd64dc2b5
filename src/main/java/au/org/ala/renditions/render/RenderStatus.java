package au.org.ala.renditions.render;

import au.org.ala.renditions.sizing.RenditionSize;
import au.org.ala.renditions.store.RenditionStore;
import com.google.common.base.MoreObjects;

/**
 * Outcome of {@link RenderScheduler#ensureRendition}: where the rendition is (or will be) and whether it is on
 * disk yet.
 */
public final class RenderStatus {

    private final RenditionStore.Resolution resolution;
    private final boolean pending;

    RenderStatus(RenditionStore.Resolution resolution, boolean pending) {
        this.resolution = resolution;
        this.pending = pending;
    }

    public RenditionStore.Resolution getResolution() {
        return resolution;
    }

    public String getRelativePath() {
        return resolution.getRelativePath();
    }

    public RenditionSize getSize() {
        return resolution.getSize();
    }

    public boolean isPending() {
        return pending;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("resolution", resolution)
                .add("pending", pending)
                .toString();
    }
}
