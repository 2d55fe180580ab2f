package io.procjobs.backend.model.query;

import io.procjobs.backend.model.entity.Access;
import io.procjobs.backend.model.entity.Job;
import io.procjobs.backend.model.entity.JobStatus;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/**
 * Conjunctive filter handed to a {@link io.procjobs.backend.repository.JobStore}.
 * Visibility restrictions are already folded in as owner and access constraints.
 */
@Value
@Builder
public class JobSearchCriteria {

    String processId;
    String serviceId;
    JobType jobType;

    @Singular
    Set<JobStatus> statuses;

    @Singular
    Set<String> tags;

    Access access;
    String userId;

    /**
     * Encoded notification contact, compared as stored
     */
    String notificationContact;

    DatetimeInterval created;
    Long minDurationSeconds;
    Long maxDurationSeconds;

    public boolean matches(Job job, Instant now) {
        if (processId != null && !processId.equals(job.getProcessId())) {
            return false;
        }
        if (serviceId != null && !serviceId.equals(job.getServiceId())) {
            return false;
        }
        if (jobType == JobType.PROCESS && job.getServiceId() != null) {
            return false;
        }
        if (jobType == JobType.PROVIDER && job.getServiceId() == null) {
            return false;
        }
        if (!statuses.isEmpty() && !statuses.contains(job.getStatus())) {
            return false;
        }
        if (!job.getTags().containsAll(tags)) {
            return false;
        }
        if (access != null && access != job.getAccess()) {
            return false;
        }
        if (userId != null && !userId.equals(job.getUserId())) {
            return false;
        }
        if (notificationContact != null && !notificationContact.equals(job.getNotificationContact())) {
            return false;
        }
        if (created != null && !created.contains(job.getCreated())) {
            return false;
        }
        if (minDurationSeconds != null || maxDurationSeconds != null) {
            long seconds = job.getDuration(now).getSeconds();
            if (minDurationSeconds != null && seconds < minDurationSeconds) {
                return false;
            }
            if (maxDurationSeconds != null && seconds > maxDurationSeconds) {
                return false;
            }
        }
        return true;
    }
}
