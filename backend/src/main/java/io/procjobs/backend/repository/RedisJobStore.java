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
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Redis-backed job store.
 * Each job is one JSON document under {@code jobs:{id}}, kept without expiry until the job is deleted.
 * The set {@code jobs:index} lists known ids and is pruned lazily when a document has gone missing.
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "spring.data.redis.enabled", havingValue = "true", matchIfMissing = true)
public class RedisJobStore implements JobStore {

    static final String JOB_KEY_PREFIX = "jobs:";
    static final String JOB_INDEX_KEY = "jobs:index";

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public RedisJobStore(StringRedisTemplate stringRedisTemplate, Clock clock) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.clock = clock;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.findAndRegisterModules(); // Support for Java 8 time types
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public Job save(Job job) {
        String document;
        try {
            document = objectMapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new JobStoreException("Failed to serialize job " + job.getId(), e);
        }
        try {
            stringRedisTemplate.opsForValue().set(JOB_KEY_PREFIX + job.getId(), document);
            stringRedisTemplate.opsForSet().add(JOB_INDEX_KEY, job.getId());
            log.debug("Stored job {} with status {}", job.getId(), job.getStatus().getValue());
            return job;
        } catch (Exception e) {
            log.error("Failed to store job {}: {}", job.getId(), e.getMessage());
            throw new JobStoreException("Failed to store job " + job.getId(), e);
        }
    }

    @Override
    public Optional<Job> findById(String jobId) {
        String document;
        try {
            document = stringRedisTemplate.opsForValue().get(JOB_KEY_PREFIX + jobId);
        } catch (Exception e) {
            log.error("Failed to read job {}: {}", jobId, e.getMessage());
            throw new JobStoreException("Failed to read job " + jobId, e);
        }
        return document == null ? Optional.empty() : Optional.of(read(document));
    }

    @Override
    public boolean delete(String jobId) {
        try {
            Boolean removed = stringRedisTemplate.delete(JOB_KEY_PREFIX + jobId);
            stringRedisTemplate.opsForSet().remove(JOB_INDEX_KEY, jobId);
            return Boolean.TRUE.equals(removed);
        } catch (Exception e) {
            log.error("Failed to delete job {}: {}", jobId, e.getMessage());
            throw new JobStoreException("Failed to delete job " + jobId, e);
        }
    }

    @Override
    public JobPage search(JobSearchCriteria criteria, JobSortField sort, int page, int limit) {
        List<Job> sorted = JobSearchSupport.filterAndSort(loadAll(), criteria, sort, clock.instant());
        return JobSearchSupport.page(sorted, page, limit);
    }

    @Override
    public List<JobGroup> group(JobSearchCriteria criteria, JobSortField sort, List<GroupBy> groups) {
        List<Job> sorted = JobSearchSupport.filterAndSort(loadAll(), criteria, sort, clock.instant());
        return JobSearchSupport.group(sorted, groups);
    }

    @Override
    public long count() {
        try {
            Long size = stringRedisTemplate.opsForSet().size(JOB_INDEX_KEY);
            return size != null ? size : 0L;
        } catch (Exception e) {
            throw new JobStoreException("Failed to count jobs", e);
        }
    }

    private List<Job> loadAll() {
        try {
            Set<String> ids = stringRedisTemplate.opsForSet().members(JOB_INDEX_KEY);
            if (ids == null || ids.isEmpty()) {
                return Collections.emptyList();
            }
            List<String> orderedIds = new ArrayList<>(ids);
            List<String> keys = new ArrayList<>(orderedIds.size());
            for (String id : orderedIds) {
                keys.add(JOB_KEY_PREFIX + id);
            }
            List<String> documents = stringRedisTemplate.opsForValue().multiGet(keys);
            if (documents == null) {
                return Collections.emptyList();
            }

            List<Job> jobs = new ArrayList<>(documents.size());
            List<String> missing = new ArrayList<>();
            for (int i = 0; i < documents.size(); i++) {
                String document = documents.get(i);
                if (document == null) {
                    missing.add(orderedIds.get(i));
                } else {
                    jobs.add(read(document));
                }
            }
            if (!missing.isEmpty()) {
                stringRedisTemplate.opsForSet().remove(JOB_INDEX_KEY, missing.toArray());
                log.info("Pruned {} job ids without document from index", missing.size());
            }
            return jobs;
        } catch (JobStoreException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to load jobs for search: {}", e.getMessage());
            throw new JobStoreException("Failed to load jobs", e);
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
