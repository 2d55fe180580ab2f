package io.procjobs.backend.service;

import io.procjobs.backend.model.entity.Access;
import io.procjobs.backend.model.execution.ProcessDescription;
import io.procjobs.backend.model.query.JobListContext;
import io.procjobs.backend.model.query.JobPage;
import io.procjobs.backend.model.query.JobQuery;
import io.procjobs.backend.model.query.JobQueryResult;
import io.procjobs.backend.model.query.JobSearchCriteria;
import io.procjobs.backend.model.query.Requester;
import io.procjobs.backend.repository.JobStore;
import io.procjobs.backend.service.exception.JobAccessDeniedException;
import io.procjobs.backend.service.exception.JobNotFoundException;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Runs job listings: resolves the collection, applies visibility rules and delegates
 * filtering, sorting, paging and grouping to the {@link JobStore}.
 */
@Slf4j
@Service
public class JobQueryService {

    private final JobStore jobStore;
    private final ProcessCatalog processCatalog;
    private final NotificationContactEncoder notificationContactEncoder;
    private final JobMetricsService metricsService;

    @Autowired
    public JobQueryService(JobStore jobStore,
                           ProcessCatalog processCatalog,
                           NotificationContactEncoder notificationContactEncoder,
                           JobMetricsService metricsService) {
        this.jobStore = jobStore;
        this.processCatalog = processCatalog;
        this.notificationContactEncoder = notificationContactEncoder;
        this.metricsService = metricsService;
    }

    /**
     * Lists the jobs matching {@code query} that {@code requester} is allowed to see.
     *
     * @throws JobNotFoundException if the scoped process or provider does not exist
     * @throws JobAccessDeniedException if the scoped process is private to the requester
     */
    public JobQueryResult findJobs(JobQuery query, JobListContext context, Requester requester) {
        verifyContext(context, requester);
        JobSearchCriteria criteria = buildCriteria(query, requester);

        JobQueryResult result;
        if (query.isGrouped()) {
            result = JobQueryResult.grouped(jobStore.group(criteria, query.getSort(), query.getGroups()));
            log.debug("Grouped listing on {} returned {} groups, {} jobs",
                    context.getJobsPath(), result.getGroups().size(), result.getTotal());
        } else {
            JobPage page = jobStore.search(criteria, query.getSort(), query.getPage(), query.getLimit());
            result = JobQueryResult.paged(page.getJobs(), page.getTotal(), query.getPage(), query.getLimit());
            log.debug("Listing on {} returned page {} ({} of {} jobs)",
                    context.getJobsPath(), query.getPage(), page.getJobs().size(), page.getTotal());
        }
        metricsService.recordQuery(query.isGrouped());
        return result;
    }

    /**
     * Folds the visibility rule into the filter.
     * Admins see everything, narrowed only by an explicit access filter. Known users see their
     * own jobs. Anonymous requesters see public jobs whatever they asked for.
     */
    JobSearchCriteria buildCriteria(JobQuery query, Requester requester) {
        JobSearchCriteria.JobSearchCriteriaBuilder criteria = JobSearchCriteria.builder()
                .processId(query.getProcessId())
                .serviceId(query.getServiceId())
                .jobType(query.getJobType())
                .statuses(query.getStatuses())
                .tags(query.getTags())
                .notificationContact(notificationContactEncoder.encode(query.getNotification()))
                .created(query.getDatetime())
                .minDurationSeconds(query.getMinDuration())
                .maxDurationSeconds(query.getMaxDuration());

        if (requester.isAdmin()) {
            criteria.access(query.getAccess());
        } else if (requester.getUserId() != null) {
            criteria.userId(requester.getUserId()).access(query.getAccess());
        } else {
            criteria.access(Access.PUBLIC);
        }
        return criteria.build();
    }

    private void verifyContext(JobListContext context, Requester requester) {
        if (context.getProviderId() != null && !processCatalog.hasProvider(context.getProviderId())) {
            throw JobNotFoundException.provider(context.getProviderId());
        }
        if (context.getProcessId() != null) {
            ProcessDescription process = processCatalog.findProcess(context.getProviderId(), context.getProcessId())
                    .orElseThrow(() -> JobNotFoundException.process(context.getProcessId()));
            if (process.getVisibility() == Access.PRIVATE && !requester.isAdmin()) {
                throw JobAccessDeniedException.process(process.getId(), !requester.isAnonymous());
            }
        }
    }
}
