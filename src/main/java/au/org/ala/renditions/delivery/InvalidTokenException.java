package au.org.ala.renditions.delivery;

/**
 * A pending token was tampered with, signed with another secret, or is not a token at all.
 */
public class InvalidTokenException extends RuntimeException {

    public InvalidTokenException(String message) {
        super(message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
