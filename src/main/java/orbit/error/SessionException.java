package orbit.error;

/**
 * Raised when session management against the manager fails.
 */
public class SessionException extends OrbitException {

    public SessionException(String message) {
        super(message);
    }

    public SessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
