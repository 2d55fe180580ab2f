package io.procjobs.backend.model.query;

import io.procjobs.backend.model.entity.Job;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a listing: a page of jobs, or groups when the query asked for grouping.
 */
@Value
public class JobQueryResult {

    List<Job> jobs;
    List<JobGroup> groups;
    long total;
    int page;
    int limit;

    public static JobQueryResult paged(List<Job> jobs, long total, int page, int limit) {
        return new JobQueryResult(jobs, null, total, page, limit);
    }

    public static JobQueryResult grouped(List<JobGroup> groups) {
        long total = 0;
        for (JobGroup group : groups) {
            total += group.getCount();
        }
        return new JobQueryResult(null, groups, total, 0, 0);
    }

    public boolean isGrouped() {
        return groups != null;
    }
}
