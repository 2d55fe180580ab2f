package io.procjobs.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.procjobs.backend.model.entity.JobStatus;
import io.procjobs.backend.model.execution.ExecutionMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer counters and timers for job submission, status changes and listings.
 */
@Slf4j
@Service
public class JobMetricsService {

    private final MeterRegistry meterRegistry;

    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();

    private final Timer syncWaitTimer;

    @Autowired
    public JobMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.syncWaitTimer = Timer.builder("jobs_sync_wait_duration_seconds")
                .description("Time spent waiting inline for synchronous jobs")
                .register(meterRegistry);
        log.info("JobMetricsService initialized");
    }

    public void recordJobCreated(ExecutionMode mode) {
        counter("jobs_created_total", "Jobs accepted for execution", "mode", mode.getValue()).increment();
    }

    public void recordStatusChange(JobStatus status) {
        counter("jobs_status_changes_total", "Job status transitions", "status", status.getValue()).increment();
    }

    public void recordDismissed() {
        counter("jobs_dismissed_total", "Jobs dismissed by request", null, null).increment();
    }

    public void recordQuery(boolean grouped) {
        counter("job_queries_total", "Job listings served", "grouped", String.valueOf(grouped)).increment();
    }

    public void recordRejectedRequest(String reason) {
        counter("job_requests_rejected_total", "Job requests rejected by validation", "reason", reason).increment();
    }

    public void recordSyncWait(Duration waited, boolean completed) {
        syncWaitTimer.record(waited);
        counter("jobs_sync_wait_total", "Synchronous waits by outcome",
                "outcome", completed ? "completed" : "timeout").increment();
    }

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        String key = tagKey == null ? name : name + "|" + tagKey + "=" + tagValue;
        return counters.computeIfAbsent(key, k -> {
            Counter.Builder builder = Counter.builder(name).description(description);
            if (tagKey != null) {
                builder.tag(tagKey, tagValue);
            }
            return builder.register(meterRegistry);
        });
    }
}
