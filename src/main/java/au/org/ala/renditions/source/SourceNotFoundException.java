package au.org.ala.renditions.source;

/**
 * The source image referenced by content does not exist, or is not an image.
 */
public class SourceNotFoundException extends RuntimeException {

    private final String path;

    public SourceNotFoundException(String path) {
        this(path, "Image not found: " + path);
    }

    public SourceNotFoundException(String path, String message) {
        super(message);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
