package orbit.error;

/**
 * Base exception for all orbit failures.
 * Unchecked: callers decide where to catch, the facade wraps everything it sees.
 */
public class OrbitException extends RuntimeException {

    public OrbitException(String message) {
        super(message);
    }

    public OrbitException(String message, Throwable cause) {
        super(message, cause);
    }
}
