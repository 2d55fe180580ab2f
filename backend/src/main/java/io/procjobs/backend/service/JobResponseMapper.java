package io.procjobs.backend.service;

import io.procjobs.backend.model.dto.JobGroupResponse;
import io.procjobs.backend.model.dto.JobListResponse;
import io.procjobs.backend.model.dto.JobStatusResponse;
import io.procjobs.backend.model.entity.Job;
import io.procjobs.backend.model.query.JobGroup;
import io.procjobs.backend.model.query.JobListContext;
import io.procjobs.backend.model.query.JobQuery;
import io.procjobs.backend.model.query.JobQueryResult;
import io.procjobs.backend.util.JobLogFormatter;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts jobs and listing results into response documents with their links.
 */
@Component
public class JobResponseMapper {

    private final JobLinkBuilder linkBuilder;
    private final Clock clock;

    @Autowired
    public JobResponseMapper(JobLinkBuilder linkBuilder, Clock clock) {
        this.linkBuilder = linkBuilder;
        this.clock = clock;
    }

    public JobStatusResponse toStatusResponse(Job job) {
        return JobStatusResponse.builder()
                .jobId(job.getId())
                .processId(job.getProcessId())
                .providerId(job.getServiceId())
                .status(job.getStatus().getValue())
                .message(job.getMessage())
                .created(job.getCreated())
                .started(job.getStarted())
                .finished(job.getFinished())
                .duration(JobLogFormatter.formatDuration(job.getDuration(clock.instant())))
                .percentCompleted((int) Math.round(job.getProgress()))
                .links(linkBuilder.jobLinks(job))
                .build();
    }

    public JobListResponse toListResponse(JobListContext context, JobQuery query, JobQueryResult result) {
        JobListResponse.JobListResponseBuilder response = JobListResponse.builder()
                .total(result.getTotal())
                .links(linkBuilder.listLinks(context, query, result));
        if (result.isGrouped()) {
            List<JobGroupResponse> groups = new ArrayList<>(result.getGroups().size());
            for (JobGroup group : result.getGroups()) {
                groups.add(JobGroupResponse.builder()
                        .category(group.getCategory())
                        .jobs(jobEntries(group.getJobs(), query.isDetail()))
                        .count(group.getCount())
                        .build());
            }
            return response.groups(groups).build();
        }
        return response
                .jobs(jobEntries(result.getJobs(), query.isDetail()))
                .page(result.getPage())
                .limit(result.getLimit())
                .build();
    }

    private List<Object> jobEntries(List<Job> jobs, boolean detail) {
        List<Object> entries = new ArrayList<>(jobs.size());
        for (Job job : jobs) {
            entries.add(detail ? toStatusResponse(job) : job.getId());
        }
        return entries;
    }
}
