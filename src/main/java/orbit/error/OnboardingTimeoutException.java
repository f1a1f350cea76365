package orbit.error;

import java.util.List;

/**
 * A readiness or certificate poll ran past its bound.
 */
public class OnboardingTimeoutException extends OnboardingException {

    private final List<String> pending;

    public OnboardingTimeoutException(String what, List<String> pending) {
        super("Timeout waiting for " + pending.size() + " device(s) to " + what);
        this.pending = List.copyOf(pending);
    }

    public int pendingCount() {
        return pending.size();
    }

    public List<String> pending() {
        return pending;
    }
}
