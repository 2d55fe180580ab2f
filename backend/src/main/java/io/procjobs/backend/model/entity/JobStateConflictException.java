package io.procjobs.backend.model.entity;

/**
 * Thrown when a status change would leave a terminal state.
 */
public class JobStateConflictException extends IllegalStateException {

    private final JobStatus current;
    private final JobStatus requested;

    public JobStateConflictException(String jobId, JobStatus current, JobStatus requested) {
        super("Job " + jobId + " cannot move from " + current.getValue() + " to " + requested.getValue());
        this.current = current;
        this.requested = requested;
    }

    public JobStatus getCurrent() {
        return current;
    }

    public JobStatus getRequested() {
        return requested;
    }
}
