package orbit.onboarding.poll;

import orbit.error.OnboardingTimeoutException;
import orbit.error.OperationCancelledException;
import orbit.onboarding.core.OnboardingListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Timeout-bounded polling over a set of device ids.
 *
 * Each sweep evaluates the check for every id that is not ready yet. A check that throws
 * counts as "not yet ready"; only the timeout (or an abort) ends the wait with an error.
 * The same loop serves device readiness and certificate-install waits, only the check
 * differs.
 */
public class ReadinessPoller {

    private static final Logger log = LoggerFactory.getLogger(ReadinessPoller.class);

    private final PollClock clock;
    private final AbortSignal abortSignal;
    private final OnboardingListener listener;
    private final Duration progressInterval;

    public ReadinessPoller(PollClock clock, AbortSignal abortSignal, OnboardingListener listener,
            Duration progressInterval) {
        this.clock = clock;
        this.abortSignal = abortSignal;
        this.listener = listener;
        this.progressInterval = progressInterval;
    }

    /**
     * Block until every id satisfies the check.
     *
     * @param ids      devices to wait for; duplicates are collapsed
     * @param check    predicate read from the manager on every sweep
     * @param timeout  overall bound
     * @param interval pause between sweeps
     * @param what     phrase for logs and errors, e.g. "complete onboarding"
     * @throws OnboardingTimeoutException  if the timeout elapses first
     * @throws OperationCancelledException if aborted or interrupted
     */
    public void waitUntilReady(Collection<String> ids, ReadinessCheck check, Duration timeout,
            Duration interval, String what) {
        if (ids.isEmpty()) {
            log.info("No devices to wait for");
            return;
        }

        Set<String> pending = new LinkedHashSet<>(ids);
        int total = pending.size();
        long timeoutMs = timeout.toMillis();
        long progressMs = Math.max(1, progressInterval.toMillis());
        long nextProgressMs = progressMs;
        long start = clock.millis();

        log.info("Waiting for {} device(s) to {}", total, what);

        while (true) {
            abortSignal.check(what);

            long elapsed = clock.millis() - start;
            if (elapsed > timeoutMs) {
                throw new OnboardingTimeoutException(what, List.copyOf(pending));
            }

            Iterator<String> it = pending.iterator();
            while (it.hasNext()) {
                String id = it.next();
                if (evaluate(check, id)) {
                    it.remove();
                    int ready = total - pending.size();
                    log.info("Device {} ready ({}/{})", id, ready, total);
                    listener.deviceReady(id, ready, total);
                }
            }

            if (pending.isEmpty()) {
                log.info("All {} device(s) ready", total);
                return;
            }

            if (elapsed >= nextProgressMs) {
                log.info("Waiting for {} device(s) to {}... ({}s elapsed)", pending.size(), what, elapsed / 1000);
                listener.waiting(what, pending.size(), elapsed / 1000);
                nextProgressMs = (elapsed / progressMs + 1) * progressMs;
            }

            pause(interval, what);
        }
    }

    private boolean evaluate(ReadinessCheck check, String id) {
        try {
            return check.isReady(id);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Interrupted while checking device " + id);
        } catch (Exception e) {
            log.debug("Error checking device {}: {}", id, e.getMessage());
            return false;
        }
    }

    private void pause(Duration interval, String what) {
        try {
            clock.sleep(interval);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Interrupted while waiting to " + what);
        }
    }
}
