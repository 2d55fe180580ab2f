package io.procjobs.backend.service;

import io.procjobs.backend.model.entity.Job;
import io.procjobs.backend.model.entity.JobOutput;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Publishes runner commands on Redis lists.
 * Runners pop {@code queue:jobs} for new work and {@code queue:control} for cancel and purge signals.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "spring.data.redis.enabled", havingValue = "true", matchIfMissing = true)
public class RedisJobDispatcher implements JobDispatcher {

    static final String JOB_QUEUE_KEY = "queue:jobs";
    static final String CONTROL_QUEUE_KEY = "queue:control";

    private final RedisTemplate<String, Object> redisTemplate;

    @Autowired
    public RedisJobDispatcher(RedisTemplate<String, Object> redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public String newTaskReference() {
        return "task-" + UUID.randomUUID();
    }

    @Override
    public void dispatch(Job job) {
        Map<String, Object> message = baseMessage("execute", job);
        message.put("process", job.getProcessId());
        message.put("provider", job.getServiceId());
        message.put("inputs", job.getInputs());
        message.put("async", job.isExecuteAsync());
        try {
            redisTemplate.opsForList().rightPush(JOB_QUEUE_KEY, message);
            log.info("Dispatched job {} as task {}", job.getId(), job.getTaskReference());
        } catch (Exception e) {
            log.error("Failed to dispatch job {}: {}", job.getId(), e.getMessage());
            throw new JobDispatchException("Failed to dispatch job " + job.getId(), e);
        }
    }

    @Override
    public void cancel(Job job) {
        sendControl(baseMessage("cancel", job));
    }

    @Override
    public void purgeArtifacts(Job job, List<JobOutput> outputs) {
        Map<String, Object> message = baseMessage("purge", job);
        List<String> hrefs = new ArrayList<>();
        for (JobOutput output : outputs) {
            hrefs.add(output.getHref());
        }
        message.put("artifacts", hrefs);
        sendControl(message);
    }

    private void sendControl(Map<String, Object> message) {
        try {
            redisTemplate.opsForList().rightPush(CONTROL_QUEUE_KEY, message);
            log.info("Sent {} signal for job {}", message.get("command"), message.get("job"));
        } catch (Exception e) {
            throw new JobDispatchException("Failed to signal runner for job " + message.get("job"), e);
        }
    }

    private static Map<String, Object> baseMessage(String command, Job job) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("command", command);
        message.put("job", job.getId());
        message.put("task", job.getTaskReference());
        message.put("issued", Instant.now().toString());
        return message;
    }
}
