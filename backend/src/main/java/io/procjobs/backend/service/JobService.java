package io.procjobs.backend.service;

import io.procjobs.backend.model.dto.JobCreateRequest;
import io.procjobs.backend.model.entity.Job;
import io.procjobs.backend.model.entity.JobError;
import io.procjobs.backend.model.entity.JobOutput;
import io.procjobs.backend.model.entity.JobStatus;
import io.procjobs.backend.model.query.Requester;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Job lifecycle management: creation, runner-reported updates, dismissal and deletion.
 * Each mutation loads the job, validates the change and stores it in a single write.
 */
public interface JobService {

    /**
     * Registers a new job with status {@code accepted}.
     *
     * @param request job attributes
     * @return the stored job
     * @throws io.procjobs.backend.model.entity.InvalidJobFieldException if a field is invalid
     */
    Job createJob(JobCreateRequest request);

    /**
     * Retrieves a job the requester is allowed to see.
     *
     * @throws io.procjobs.backend.service.exception.JobNotFoundException if the job does not exist
     * @throws io.procjobs.backend.service.exception.JobAccessDeniedException if the job is private to someone else
     */
    Job getJob(String jobId, Requester requester);

    /**
     * Retrieves a job without visibility checks, for the runner and internal polling.
     *
     * @throws io.procjobs.backend.service.exception.JobNotFoundException if the job does not exist
     */
    Job findJob(String jobId);

    /**
     * Applies a status reported by the runner and logs the transition.
     * Re-applying the current status only updates the message.
     *
     * @param timestamp time of the change, current time when null
     * @throws io.procjobs.backend.model.entity.JobStateConflictException if the job is already finished
     *         with another status
     */
    Job applyStatus(String jobId, JobStatus status, String message, Instant timestamp);

    /**
     * @throws io.procjobs.backend.model.entity.InvalidJobFieldException if progress is outside [0, 100]
     */
    Job applyProgress(String jobId, double progress, String message);

    Job appendLog(String jobId, String message, String level, Instant timestamp);

    Job recordException(String jobId, JobError error);

    Job recordResult(String jobId, JobOutput output);

    /**
     * Dismisses a job: a pending job becomes {@code dismissed} and the runner is told to stop,
     * result artifacts are released. Dismissing a dismissed job changes nothing.
     */
    Job dismissJob(String jobId, Requester requester);

    /**
     * Dismisses every listed job the requester may modify; unknown ids are skipped.
     *
     * @return ids of the dismissed jobs
     */
    List<String> dismissJobs(Collection<String> jobIds, Requester requester);

    /**
     * Removes a job permanently.
     *
     * @return true once removed
     * @throws io.procjobs.backend.service.exception.JobNotFoundException if the job does not exist
     */
    boolean deleteJob(String jobId, Requester requester);

    /**
     * Exception thrown when the job backend fails
     */
    class JobServiceException extends RuntimeException {
        public JobServiceException(String message) {
            super(message);
        }

        public JobServiceException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
