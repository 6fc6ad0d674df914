package shipguard.spi;

/**
 * Thrown by an {@link AuditSink} that could not persist an event.
 */
public class AuditSinkException extends Exception {

    public AuditSinkException(String message) {
        super(message);
    }

    public AuditSinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
