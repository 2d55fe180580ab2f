package io.procjobs.backend.repository;

import io.procjobs.backend.model.entity.Job;
import io.procjobs.backend.model.query.GroupBy;
import io.procjobs.backend.model.query.JobGroup;
import io.procjobs.backend.model.query.JobPage;
import io.procjobs.backend.model.query.JobSearchCriteria;
import io.procjobs.backend.model.query.JobSortField;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Job store kept in process memory, used when Redis is disabled.
 * Records are held as JSON snapshots so callers never share mutable instances.
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "spring.data.redis.enabled", havingValue = "false")
public class InMemoryJobStore implements JobStore {

    private final ConcurrentHashMap<String, String> documents = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public InMemoryJobStore(Clock clock) {
        this.clock = clock;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.findAndRegisterModules();
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        log.info("Using in-memory job store, jobs will not survive a restart");
    }

    @Override
    public Job save(Job job) {
        documents.put(job.getId(), write(job));
        return job;
    }

    @Override
    public Optional<Job> findById(String jobId) {
        String document = documents.get(jobId);
        return document == null ? Optional.empty() : Optional.of(read(document));
    }

    @Override
    public boolean delete(String jobId) {
        return documents.remove(jobId) != null;
    }

    @Override
    public JobPage search(JobSearchCriteria criteria, JobSortField sort, int page, int limit) {
        List<Job> sorted = JobSearchSupport.filterAndSort(snapshot(), criteria, sort, clock.instant());
        return JobSearchSupport.page(sorted, page, limit);
    }

    @Override
    public List<JobGroup> group(JobSearchCriteria criteria, JobSortField sort, List<GroupBy> groups) {
        List<Job> sorted = JobSearchSupport.filterAndSort(snapshot(), criteria, sort, clock.instant());
        return JobSearchSupport.group(sorted, groups);
    }

    @Override
    public long count() {
        return documents.size();
    }

    private List<Job> snapshot() {
        return documents.values().stream().map(this::read).collect(Collectors.toList());
    }

    private String write(Job job) {
        try {
            return objectMapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new JobStoreException("Failed to serialize job " + job.getId(), e);
        }
    }

    private Job read(String document) {
        try {
            return objectMapper.readValue(document, Job.class);
        } catch (JsonProcessingException e) {
            throw new JobStoreException("Failed to deserialize stored job", e);
        }
    }
}
