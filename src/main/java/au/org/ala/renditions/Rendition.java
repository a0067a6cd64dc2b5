package au.org.ala.renditions;

import au.org.ala.renditions.sizing.RenditionSize;
import com.google.common.base.MoreObjects;

import java.util.Objects;
import java.util.Optional;

/**
 * A URL for an image variant. Pending renditions point at the async endpoint rather than the cache.
 */
public final class Rendition {

    private final String url;
    private final RenditionSize size;
    private final boolean pending;

    public Rendition(String url, RenditionSize size, boolean pending) {
        this.url = Objects.requireNonNull(url);
        this.size = size;
        this.pending = pending;
    }

    public String getUrl() {
        return url;
    }

    /** Pixel size of the rendition; empty for images that are not rendered locally */
    public Optional<RenditionSize> getSize() {
        return Optional.ofNullable(size);
    }

    public boolean isPending() {
        return pending;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Rendition)) return false;
        Rendition that = (Rendition) o;
        return pending == that.pending && url.equals(that.url) && Objects.equals(size, that.size);
    }

    @Override
    public int hashCode() {
        return Objects.hash(url, size, pending);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .omitNullValues()
                .add("url", url)
                .add("size", size)
                .add("pending", pending)
                .toString();
    }
}
