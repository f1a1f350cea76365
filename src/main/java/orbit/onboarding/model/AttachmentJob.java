package orbit.onboarding.model;

import java.util.Objects;

/**
 * Tracks one asynchronous attachment job from submission until a terminal status.
 */
public final class AttachmentJob {

    private final String id;
    private JobState state = JobState.PENDING;
    private String lastStatus;

    public AttachmentJob(String id) {
        this.id = Objects.requireNonNull(id, "id is required");
    }

    public String id() {
        return id;
    }

    public JobState state() {
        return state;
    }

    public String lastStatus() {
        return lastStatus;
    }

    /** Record a freshly read status and return the resulting state */
    public JobState update(String status) {
        this.lastStatus = status;
        this.state = JobState.classify(status);
        return state;
    }

    @Override
    public String toString() {
        return "AttachmentJob{id='" + id + "', state=" + state + ", lastStatus='" + lastStatus + "'}";
    }
}
