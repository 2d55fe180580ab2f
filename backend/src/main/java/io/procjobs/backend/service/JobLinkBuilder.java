package io.procjobs.backend.service;

import io.procjobs.backend.model.dto.Link;
import io.procjobs.backend.model.entity.Job;
import io.procjobs.backend.model.entity.JobStatus;
import io.procjobs.backend.model.entity.StatusCategory;
import io.procjobs.backend.model.query.JobListContext;
import io.procjobs.backend.model.query.JobQuery;
import io.procjobs.backend.model.query.JobQueryResult;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds hypermedia links for jobs and job listings.
 *
 * Listing links replay the active filters. Paging links are relative to the collection the
 * listing was requested on, {@code search} always targets the global collection, and scoped
 * collections get an {@code alternate} link to the equivalent global query.
 */
@Component
public class JobLinkBuilder {

    public static final String REL_SELF = "self";
    public static final String REL_FIRST = "first";
    public static final String REL_LAST = "last";
    public static final String REL_NEXT = "next";
    public static final String REL_PREV = "prev";
    public static final String REL_UP = "up";
    public static final String REL_COLLECTION = "collection";
    public static final String REL_SEARCH = "search";
    public static final String REL_ALTERNATE = "alternate";

    private static final List<String> GLOBAL_JOBS = List.of("jobs");

    private final String baseUrl;

    @Autowired
    public JobLinkBuilder(@Value("${app.api.base-url:http://localhost:8080}") String baseUrl) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    /**
     * Links of a listing response.
     * Grouped listings carry no paging links.
     */
    public List<Link> listLinks(JobListContext context, JobQuery query, JobQueryResult result) {
        Map<String, String> filters = query.getParameters();
        List<String> contextPath = context.getJobsSegments();
        List<Link> links = new ArrayList<>();

        if (result.isGrouped()) {
            links.add(Link.of(REL_SELF, url(contextPath, filters), "Current job groups"));
        } else {
            int limit = result.getLimit();
            int page = result.getPage();
            int lastPage = lastPage(result.getTotal(), limit);

            links.add(Link.of(REL_SELF, pageUrl(contextPath, filters, page, limit), "Current page of job results"));
            links.add(Link.of(REL_FIRST, pageUrl(contextPath, filters, 0, limit), "First page of job results"));
            links.add(Link.of(REL_LAST, pageUrl(contextPath, filters, lastPage, limit), "Last page of job results"));
            if (page > 0) {
                links.add(Link.of(REL_PREV, pageUrl(contextPath, filters, Math.min(page - 1, lastPage), limit),
                        "Previous page of job results"));
            }
            if (page < lastPage) {
                links.add(Link.of(REL_NEXT, pageUrl(contextPath, filters, page + 1, limit), "Next page of job results"));
            }
        }

        if (context.isScoped()) {
            links.add(Link.of(REL_UP, url(context.getParentSegments(), Map.of()), parentTitle(context)));
        }
        links.add(Link.of(REL_COLLECTION, url(contextPath, filters), "Job collection"));
        links.add(Link.of(REL_SEARCH, url(GLOBAL_JOBS, filters), "Search over all jobs"));

        if (context.isScoped()) {
            Map<String, String> globalFilters = new LinkedHashMap<>(filters);
            if (context.getProcessId() != null) {
                globalFilters.put(JobQueryParser.PROCESS, context.getProcessId());
            }
            if (context.getProviderId() != null) {
                globalFilters.put(JobQueryParser.PROVIDER, context.getProviderId());
            }
            String alternate = result.isGrouped()
                    ? url(GLOBAL_JOBS, globalFilters)
                    : pageUrl(GLOBAL_JOBS, globalFilters, result.getPage(), result.getLimit());
            links.add(Link.of(REL_ALTERNATE, alternate, "Same listing within the global job collection"));
        }
        return links;
    }

    /**
     * Links of a single job.
     */
    public List<Link> jobLinks(Job job) {
        String jobId = job.getId();
        List<Link> links = new ArrayList<>();
        links.add(Link.of(REL_SELF, jobUrl(jobId), "Job status"));
        links.add(Link.of(REL_UP, url(processSegments(job), Map.of()), "Process description"));
        links.add(Link.of("logs", url(List.of("jobs", jobId, "logs"), Map.of()), "Job logs"));
        if (job.getStatus() == JobStatus.SUCCEEDED) {
            links.add(Link.of("results", url(List.of("jobs", jobId, "results"), Map.of()), "Job results"));
            links.add(Link.of("outputs", url(List.of("jobs", jobId, "outputs"), Map.of()), "Job outputs"));
        } else if (job.getStatusCategory() == StatusCategory.FINISHED_FAILURE) {
            links.add(Link.of("exceptions", url(List.of("jobs", jobId, "exceptions"), Map.of()), "Job exceptions"));
        }
        return links;
    }

    public String jobUrl(String jobId) {
        return url(List.of("jobs", jobId), Map.of());
    }

    /**
     * Last page index for {@code total} items, 0 when there are none.
     */
    static int lastPage(long total, int limit) {
        if (total <= 0 || limit <= 0) {
            return 0;
        }
        return (int) ((total + limit - 1) / limit) - 1;
    }

    private String pageUrl(List<String> path, Map<String, String> filters, int page, int limit) {
        UriComponentsBuilder builder = builder(path, filters);
        builder.queryParam("limit", limit);
        builder.queryParam("page", page);
        return builder.build().encode().toUriString();
    }

    private String url(List<String> path, Map<String, String> filters) {
        return builder(path, filters).build().encode().toUriString();
    }

    /**
     * Each path element is encoded as a single segment, so ids containing '/' or spaces stay intact.
     */
    private UriComponentsBuilder builder(List<String> path, Map<String, String> filters) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .pathSegment(path.toArray(new String[0]));
        for (Map.Entry<String, String> filter : filters.entrySet()) {
            builder.queryParam(filter.getKey(), filter.getValue());
        }
        return builder;
    }

    private static List<String> processSegments(Job job) {
        if (job.getServiceId() != null) {
            return List.of("providers", job.getServiceId(), "processes", job.getProcessId());
        }
        return List.of("processes", job.getProcessId());
    }

    private static String parentTitle(JobListContext context) {
        return context.getProcessId() != null ? "Process description" : "Provider description";
    }
}
