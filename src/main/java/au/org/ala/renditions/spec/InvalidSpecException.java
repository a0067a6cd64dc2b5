package au.org.ala.renditions.spec;

/**
 * Thrown synchronously when a rendition option cannot be understood, e.g. an unknown resize mode or
 * scale filter, or a numeric option outside of its permitted range.
 */
public class InvalidSpecException extends IllegalArgumentException {

    public InvalidSpecException(String message) {
        super(message);
    }

    public InvalidSpecException(String message, Throwable cause) {
        super(message, cause);
    }
}
