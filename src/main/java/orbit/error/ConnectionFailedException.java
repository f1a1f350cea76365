package orbit.error;

/**
 * Connection retries exhausted. The cause is the last underlying failure.
 */
public class ConnectionFailedException extends SessionException {

    private final int attempts;

    public ConnectionFailedException(String message, int attempts, Throwable lastCause) {
        super(message, lastCause);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
