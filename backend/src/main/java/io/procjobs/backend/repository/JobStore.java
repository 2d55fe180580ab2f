package io.procjobs.backend.repository;

import io.procjobs.backend.model.entity.Job;
import io.procjobs.backend.model.query.GroupBy;
import io.procjobs.backend.model.query.JobGroup;
import io.procjobs.backend.model.query.JobPage;
import io.procjobs.backend.model.query.JobSearchCriteria;
import io.procjobs.backend.model.query.JobSortField;

import java.util.List;
import java.util.Optional;

/**
 * Storage contract for job records.
 * Every {@link #save} is a single-record write; concurrent writers of the same job resolve
 * as last write wins.
 */
public interface JobStore {

    /**
     * Inserts or replaces the record with the job's id.
     *
     * @return the stored job
     * @throws JobStoreException if the backend cannot be written
     */
    Job save(Job job);

    Optional<Job> findById(String jobId);

    /**
     * @return false if no record had this id
     */
    boolean delete(String jobId);

    /**
     * Filters, sorts and cuts the window {@code [page*limit, page*limit+limit)}.
     * The returned total counts all matches regardless of the window.
     */
    JobPage search(JobSearchCriteria criteria, JobSortField sort, int page, int limit);

    /**
     * Partitions all matches by the distinct tuple of the given fields.
     * Group order follows the first member of each group in sort order.
     */
    List<JobGroup> group(JobSearchCriteria criteria, JobSortField sort, List<GroupBy> groups);

    long count();

    /**
     * Storage backend failure, unrelated to the content of the request.
     */
    class JobStoreException extends RuntimeException {
        public JobStoreException(String message) {
            super(message);
        }

        public JobStoreException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
