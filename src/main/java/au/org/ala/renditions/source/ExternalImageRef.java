package au.org.ala.renditions.source;

import au.org.ala.renditions.Rendition;
import au.org.ala.renditions.spec.RenditionSpec;
import au.org.ala.renditions.spec.ResizeMode;
import com.google.common.html.HtmlEscapers;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * An image that is served by something else: a remote URL, or a static file. Nothing is rendered, so sizing is
 * approximated in the markup, using CSS background sizing for fit and fill.
 */
public class ExternalImageRef implements ImageRef {

    /** A transparent 1x1 GIF, used as the img source when the image is drawn as a background */
    public static final String SPACER_SRC = "data:image/gif;base64,R0lGODlhAQABAIAAAAAAAP///yH5BAEAAAAALAAAAAABAAEAAAIBRAA7";

    private final SourceKind kind;
    private final String url;

    public ExternalImageRef(SourceKind kind, String url) {
        if (kind != SourceKind.REMOTE && kind != SourceKind.STATIC_ASSET) {
            throw new IllegalArgumentException("Not an external kind: " + kind);
        }
        this.kind = kind;
        this.url = url;
    }

    public String getUrl() {
        return url;
    }

    @Override
    public SourceKind getKind() {
        return kind;
    }

    @Override
    public Rendition getRendition(RenditionSpec spec, double outputScale) {
        return new Rendition(url, null, false);
    }

    @Override
    public Map<String, String> getImgAttrs(RenditionSpec spec) {
        Integer maxWidth = spec.getMaxWidth().orElse(null);
        Integer maxHeight = spec.getMaxHeight().orElse(null);
        Double width = spec.getWidth().map(Integer::doubleValue).orElse(maxWidth == null ? null : maxWidth.doubleValue());
        Double height = spec.getHeight().map(Integer::doubleValue).orElse(maxHeight == null ? null : maxHeight.doubleValue());

        if (width != null && maxWidth != null && maxWidth < width) {
            if (height != null) {
                height = height * maxWidth / width;
            }
            width = maxWidth.doubleValue();
        }
        if (height != null && maxHeight != null && maxHeight < height) {
            if (width != null) {
                width = width * maxHeight / height;
            }
            height = maxHeight.doubleValue();
        }

        Map<String, String> attrs = new LinkedHashMap<>();
        ResizeMode mode = spec.getResize();
        if (width != null && height != null && mode != ResizeMode.STRETCH) {
            List<String> style = new ArrayList<>();
            style.add("background-image:url('" + HtmlEscapers.htmlEscaper().escape(url) + "')");
            style.add("background-size:" + (mode == ResizeMode.FILL ? "cover" : "contain"));
            style.add(String.format(Locale.ROOT, "background-position:%.1f%% %.1f%%",
                    spec.getFillCropX() * 100, spec.getFillCropY() * 100));
            style.add("background-repeat:no-repeat");
            attrs.put("src", SPACER_SRC);
            attrs.put("style", String.join(";", style));
        } else {
            attrs.put("src", url);
        }
        if (width != null) {
            attrs.put("width", dimension(width));
        }
        if (height != null) {
            attrs.put("height", dimension(height));
        }
        return attrs;
    }

    @Override
    public String getCssBackground(RenditionSpec spec) {
        return "background-image: url(\"" + url + "\");";
    }

    private static String dimension(double v) {
        return new BigDecimal(v).setScale(2, RoundingMode.HALF_UP).stripTrailingZeros().toPlainString();
    }

    @Override
    public String toString() {
        return "ExternalImageRef[" + kind + " " + url + "]";
    }
}
