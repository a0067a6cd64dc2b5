package au.org.ala.renditions.sizing;

import java.util.Objects;

public final class RenditionSize {

    public final int width;
    public final int height;

    public RenditionSize(int width, int height) {
        this.width = width;
        this.height = height;
    }

    public String label() {
        return width + "x" + height;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RenditionSize)) return false;
        RenditionSize that = (RenditionSize) o;
        return width == that.width && height == that.height;
    }

    @Override
    public int hashCode() {
        return Objects.hash(width, height);
    }

    @Override
    public String toString() {
        return label();
    }
}
