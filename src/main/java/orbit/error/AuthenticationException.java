package orbit.error;

/**
 * Manager credentials were rejected. Never retried.
 */
public class AuthenticationException extends SessionException {

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
