package orbit.onboarding.poll;

import orbit.error.OperationCancelledException;

/**
 * Lets a calling process abort a stuck wait. Checked once per poll sweep.
 */
public final class AbortSignal {

    private volatile boolean aborted;
    private volatile String reason;

    public void abort(String reason) {
        this.reason = reason;
        this.aborted = true;
    }

    public boolean isAborted() {
        return aborted;
    }

    /**
     * @throws OperationCancelledException if aborted
     */
    public void check(String what) {
        if (aborted) {
            throw new OperationCancelledException("Aborted while waiting to " + what + ": " + reason);
        }
    }
}
