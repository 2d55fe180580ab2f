package io.procjobs.backend.service;

import io.procjobs.backend.model.entity.Job;
import io.procjobs.backend.model.entity.JobOutput;

import java.util.List;

/**
 * Hand-off point to the external runner that executes jobs and reports back through the
 * runner callback API. All signals are best-effort: the runner may be unavailable or ignore them.
 */
public interface JobDispatcher {

    /**
     * Correlation id under which the runner will know the next job.
     */
    String newTaskReference();

    void dispatch(Job job);

    /**
     * Asks the runner to stop working on the job.
     */
    void cancel(Job job);

    /**
     * Asks the runner to remove stored result artifacts of a dismissed job.
     */
    void purgeArtifacts(Job job, List<JobOutput> outputs);

    class JobDispatchException extends RuntimeException {
        public JobDispatchException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
