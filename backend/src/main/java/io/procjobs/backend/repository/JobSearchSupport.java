package io.procjobs.backend.repository;

import io.procjobs.backend.model.entity.Job;
import io.procjobs.backend.model.query.GroupBy;
import io.procjobs.backend.model.query.JobGroup;
import io.procjobs.backend.model.query.JobPage;
import io.procjobs.backend.model.query.JobSearchCriteria;
import io.procjobs.backend.model.query.JobSortField;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Filter, sort, page and group reduction over an in-memory snapshot of jobs.
 * Used by stores that cannot push these operations down to the backend.
 */
final class JobSearchSupport {

    private JobSearchSupport() {
    }

    static List<Job> filterAndSort(Collection<Job> jobs, JobSearchCriteria criteria, JobSortField sort, Instant now) {
        return jobs.stream()
                .filter(job -> criteria.matches(job, now))
                .sorted(comparator(sort))
                .collect(Collectors.toList());
    }

    static JobPage page(List<Job> sorted, int page, int limit) {
        long offset = (long) page * limit;
        if (offset >= sorted.size()) {
            return new JobPage(Collections.emptyList(), sorted.size());
        }
        int from = (int) offset;
        int to = (int) Math.min(sorted.size(), offset + limit);
        return new JobPage(new ArrayList<>(sorted.subList(from, to)), sorted.size());
    }

    static List<JobGroup> group(List<Job> sorted, List<GroupBy> groups) {
        Map<List<Object>, List<Job>> partitions = new LinkedHashMap<>();
        for (Job job : sorted) {
            List<Object> key = new ArrayList<>(groups.size());
            for (GroupBy groupBy : groups) {
                key.add(groupBy.getField().extract(job));
            }
            partitions.computeIfAbsent(key, k -> new ArrayList<>()).add(job);
        }

        List<JobGroup> result = new ArrayList<>(partitions.size());
        for (Map.Entry<List<Object>, List<Job>> partition : partitions.entrySet()) {
            Map<String, Object> category = new LinkedHashMap<>();
            for (int i = 0; i < groups.size(); i++) {
                category.put(groups.get(i).getLabel(), partition.getKey().get(i));
            }
            result.add(new JobGroup(category, partition.getValue()));
        }
        return result;
    }

    /**
     * Comparator for a sort key; missing values sort last and ties break on job id.
     */
    static Comparator<Job> comparator(JobSortField sort) {
        boolean descending = sort.isDescending();
        switch (sort) {
            case CREATED:
                return keyed(Job::getCreated, descending).thenComparing(Job::getId);
            case FINISHED:
                return keyed(Job::getFinished, descending).thenComparing(Job::getId);
            case STATUS:
                return keyed(job -> job.getStatus().getValue(), descending).thenComparing(Job::getId);
            case PROCESS:
                return keyed(Job::getProcessId, descending).thenComparing(Job::getId);
            case SERVICE:
                return keyed(Job::getServiceId, descending).thenComparing(Job::getId);
            case USER:
                return keyed(Job::getUserId, descending).thenComparing(Job::getId);
            case ID:
            default:
                return keyed(Job::getId, descending);
        }
    }

    private static <T extends Comparable<? super T>> Comparator<Job> keyed(Function<Job, T> extractor,
                                                                         boolean descending) {
        Comparator<T> order = descending ? Comparator.<T>reverseOrder() : Comparator.<T>naturalOrder();
        return Comparator.comparing(extractor, Comparator.nullsLast(order));
    }
}
