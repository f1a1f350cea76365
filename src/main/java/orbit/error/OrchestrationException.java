package orbit.error;

/**
 * Top-level wrapper for any failure surfaced from the orchestration facade.
 * Partial results gathered before the failing phase are not carried.
 */
public class OrchestrationException extends OrbitException {

    public OrchestrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
