package shipguard.core.model.auth;

/**
 * Thrown when a bearer credential cannot be verified or has expired.
 */
public class InvalidTokenException extends Exception {

    public InvalidTokenException(String message) {
        super(message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
