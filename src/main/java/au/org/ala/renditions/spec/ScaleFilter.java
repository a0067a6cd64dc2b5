package au.org.ala.renditions.spec;

import com.twelvemonkeys.image.ResampleOp;

import java.util.Locale;

/**
 * Named resampling filters, mapped onto {@link ResampleOp} filter types.
 */
public enum ScaleFilter {
    NEAREST(ResampleOp.FILTER_POINT),
    BOX(ResampleOp.FILTER_BOX),
    BILINEAR(ResampleOp.FILTER_TRIANGLE),
    HAMMING(ResampleOp.FILTER_HAMMING),
    BICUBIC(ResampleOp.FILTER_CUBIC),
    LANCZOS(ResampleOp.FILTER_LANCZOS);

    private final int resampleFilter;

    ScaleFilter(int resampleFilter) {
        this.resampleFilter = resampleFilter;
    }

    public int getResampleFilter() {
        return resampleFilter;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ScaleFilter parse(String s) {
        if (s == null) {
            throw new InvalidSpecException("Scale filter is null");
        }
        String in = s.trim().toLowerCase(Locale.ROOT);
        for (ScaleFilter filter : values()) {
            if (filter.label().equals(in)) {
                return filter;
            }
        }
        throw new InvalidSpecException("Unknown scale filter " + s);
    }
}
