package au.org.ala.renditions.source;

import au.org.ala.renditions.Rendition;
import au.org.ala.renditions.spec.RenditionSpec;

import java.util.Map;

public class MissingImageRef implements ImageRef {

    private final String path;

    public MissingImageRef(String path) {
        this.path = path;
    }

    public String getPath() {
        return path;
    }

    @Override
    public SourceKind getKind() {
        return SourceKind.MISSING;
    }

    @Override
    public Rendition getRendition(RenditionSpec spec, double outputScale) {
        throw new SourceNotFoundException(path);
    }

    @Override
    public Map<String, String> getImgAttrs(RenditionSpec spec) {
        throw new SourceNotFoundException(path);
    }

    @Override
    public String getCssBackground(RenditionSpec spec) {
        return "/* not found: " + path + " */";
    }

    @Override
    public String toString() {
        return "MissingImageRef[" + path + "]";
    }
}
