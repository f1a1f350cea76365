package orbit.error;

/**
 * A wait was aborted from outside (abort signal or thread interrupt).
 */
public class OperationCancelledException extends OnboardingException {

    public OperationCancelledException(String message) {
        super(message);
    }
}
