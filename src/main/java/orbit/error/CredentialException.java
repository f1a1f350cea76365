package orbit.error;

import java.util.List;

/**
 * Every credential candidate was rejected while registering a control component.
 * Each rejected attempt is attached as a suppressed exception, in attempt order.
 */
public class CredentialException extends OnboardingException {

    private final String deviceIp;

    public CredentialException(String deviceIp, List<? extends Throwable> attempts) {
        super("Failed to authenticate to " + deviceIp + " with "
                + attempts.size() + " credential candidate(s)");
        this.deviceIp = deviceIp;
        attempts.forEach(this::addSuppressed);
    }

    public String deviceIp() {
        return deviceIp;
    }
}
