package orbit.onboarding.model;

import java.util.Locale;

/**
 * Lifecycle of an asynchronous manager job.
 */
public enum JobState {
    /** Submitted, no terminal status yet */
    PENDING,
    /** Status reported "success" (any case) */
    SUCCEEDED,
    /** Status contains "fail" (any case) */
    FAILED;

    public static JobState classify(String status) {
        if (status == null || status.isBlank()) {
            return PENDING;
        }
        if ("success".equalsIgnoreCase(status.trim())) {
            return SUCCEEDED;
        }
        if (status.toLowerCase(Locale.ROOT).contains("fail")) {
            return FAILED;
        }
        return PENDING;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }
}
