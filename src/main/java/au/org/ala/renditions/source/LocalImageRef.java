package au.org.ala.renditions.source;

import au.org.ala.renditions.Rendition;
import au.org.ala.renditions.RenditionService;
import au.org.ala.renditions.sizing.RenditionSize;
import au.org.ala.renditions.spec.RenditionSpec;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A local source image, offered at 1x and 2x pixel density.
 */
public class LocalImageRef implements ImageRef {

    private final RenditionService service;
    private final SourceImage source;

    public LocalImageRef(RenditionService service, SourceImage source) {
        this.service = service;
        this.source = source;
    }

    public SourceImage getSource() {
        return source;
    }

    @Override
    public SourceKind getKind() {
        return SourceKind.LOCAL;
    }

    @Override
    public Rendition getRendition(RenditionSpec spec, double outputScale) {
        return service.getRendition(source, spec, outputScale);
    }

    @Override
    public Map<String, String> getImgAttrs(RenditionSpec spec) {
        Rendition x1 = getRendition(spec, 1);
        Rendition x2 = getRendition(spec, 2);

        Map<String, String> attrs = new LinkedHashMap<>();
        attrs.put("src", x1.getUrl());
        if (x1.getSize().isPresent()) {
            RenditionSize size = x1.getSize().get();
            attrs.put("width", Integer.toString(size.width));
            attrs.put("height", Integer.toString(size.height));
        }
        if (!x1.getUrl().equals(x2.getUrl())) {
            attrs.put("srcset", x1.getUrl() + " 1x, " + x2.getUrl() + " 2x");
        }
        return attrs;
    }

    @Override
    public String getCssBackground(RenditionSpec spec) {
        String x1 = getRendition(spec, 1).getUrl();
        String x2 = getRendition(spec, 2).getUrl();
        StringBuilder css = new StringBuilder("background-image: url(\"").append(x1).append("\");");
        if (!x1.equals(x2)) {
            String imageSet = "image-set(url(\"" + x1 + "\") 1x, url(\"" + x2 + "\") 2x)";
            css.append("background-image: ").append(imageSet).append(';');
            css.append("background-image: -webkit-").append(imageSet).append(';');
        }
        return css.toString();
    }

    @Override
    public String toString() {
        return "LocalImageRef[" + source.getPath() + "]";
    }
}
