package orbit.onboarding.service;

import orbit.error.AttachmentException;
import orbit.error.OperationCancelledException;
import orbit.manager.client.ManagerClient;
import orbit.manager.model.JobStatusReport;
import orbit.onboarding.model.AttachmentJob;
import orbit.onboarding.model.JobState;
import orbit.onboarding.poll.AbortSignal;
import orbit.onboarding.poll.PollClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Polls an asynchronous manager job until it reports success or failure.
 *
 * Read errors while polling mean "status not known yet" and never end the wait early.
 */
public class JobTracker {

    private static final Logger log = LoggerFactory.getLogger(JobTracker.class);

    private final ManagerClient client;
    private final PollClock clock;
    private final AbortSignal abortSignal;
    private final Duration interval;
    private final Duration progressInterval;

    public JobTracker(ManagerClient client, PollClock clock, AbortSignal abortSignal, Duration interval,
            Duration progressInterval) {
        this.client = client;
        this.clock = clock;
        this.abortSignal = abortSignal;
        this.interval = interval;
        this.progressInterval = progressInterval;
    }

    /**
     * Wait for a job to finish.
     *
     * @return the job in state {@link JobState#SUCCEEDED}
     * @throws AttachmentException if the job reports failure or the timeout elapses
     */
    public AttachmentJob await(String jobId, Duration timeout) {
        AttachmentJob job = new AttachmentJob(jobId);
        String what = "finish task " + jobId;
        long start = clock.millis();
        long progressMs = Math.max(1, progressInterval.toMillis());
        long nextProgressMs = progressMs;

        log.info("Waiting for task {} to complete", jobId);

        while (true) {
            abortSignal.check(what);

            long elapsed = clock.millis() - start;
            if (elapsed > timeout.toMillis()) {
                throw new AttachmentException("Timeout waiting for task " + jobId
                        + " (last status: " + job.lastStatus() + ")");
            }

            JobStatusReport report = readStatus(jobId);
            if (report != null) {
                JobState state = job.update(report.status());
                if (state == JobState.SUCCEEDED) {
                    log.info("Task {} completed successfully", jobId);
                    return job;
                }
                if (state == JobState.FAILED) {
                    throw new AttachmentException("Task " + jobId + " failed: " + report.raw());
                }
            }

            if (elapsed >= nextProgressMs) {
                log.info("Waiting for task {}... ({}s elapsed)", jobId, elapsed / 1000);
                nextProgressMs = (elapsed / progressMs + 1) * progressMs;
            }

            try {
                clock.sleep(interval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OperationCancelledException("Interrupted while waiting to " + what);
            }
        }
    }

    private JobStatusReport readStatus(String jobId) {
        try {
            return client.getJobStatus(jobId);
        } catch (RuntimeException e) {
            log.debug("Error checking status of task {}: {}", jobId, e.getMessage());
            return null;
        }
    }
}
