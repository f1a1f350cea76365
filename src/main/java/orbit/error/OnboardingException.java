package orbit.error;

/**
 * Raised when device onboarding fails.
 */
public class OnboardingException extends OrbitException {

    public OnboardingException(String message) {
        super(message);
    }

    public OnboardingException(String message, Throwable cause) {
        super(message, cause);
    }
}
