package au.org.ala.renditions.sizing;

import java.util.Objects;

/**
 * A region of the source image in source pixel coordinates, right and bottom exclusive.
 */
public final class CropBox {

    public final int left, top, right, bottom;

    public CropBox(int left, int top, int right, int bottom) {
        this.left = left;
        this.top = top;
        this.right = right;
        this.bottom = bottom;
    }

    public int getWidth() {
        return right - left;
    }

    public int getHeight() {
        return bottom - top;
    }

    public CropBox offset(int dx, int dy) {
        return new CropBox(left + dx, top + dy, right + dx, bottom + dy);
    }

    public boolean isWithin(int width, int height) {
        return left >= 0 && top >= 0 && right <= width && bottom <= height && left < right && top < bottom;
    }

    public String label() {
        return left + "-" + top + "-" + right + "-" + bottom;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CropBox)) return false;
        CropBox box = (CropBox) o;
        return left == box.left && top == box.top && right == box.right && bottom == box.bottom;
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, top, right, bottom);
    }

    @Override
    public String toString() {
        return "CropBox{" + label() + '}';
    }
}
