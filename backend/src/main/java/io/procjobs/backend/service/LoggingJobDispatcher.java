package io.procjobs.backend.service;

import io.procjobs.backend.model.entity.Job;
import io.procjobs.backend.model.entity.JobOutput;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Dispatcher used without Redis: jobs stay accepted until a runner reports through the callback API.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "spring.data.redis.enabled", havingValue = "false")
public class LoggingJobDispatcher implements JobDispatcher {

    @Override
    public String newTaskReference() {
        return "local-" + UUID.randomUUID();
    }

    @Override
    public void dispatch(Job job) {
        log.info("No runner queue configured, job {} ({}) awaits external runner callbacks",
                job.getId(), job.getTaskReference());
    }

    @Override
    public void cancel(Job job) {
        log.info("Cancel requested for job {} ({})", job.getId(), job.getTaskReference());
    }

    @Override
    public void purgeArtifacts(Job job, List<JobOutput> outputs) {
        log.info("Purge requested for {} artifacts of job {}", outputs.size(), job.getId());
    }
}
