package io.procjobs.backend.health;

import io.procjobs.backend.repository.JobStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Health of the job store, rated by how fast it answers a count of stored jobs.
 */
@Component
public class JobStoreHealthIndicator implements HealthIndicator {

    private static final Logger logger = LoggerFactory.getLogger(JobStoreHealthIndicator.class);

    // Performance thresholds (milliseconds)
    private static final long GOOD_RESPONSE_TIME_MS = 100;
    private static final long WARNING_RESPONSE_TIME_MS = 500;

    private final JobStore jobStore;

    @Autowired
    public JobStoreHealthIndicator(JobStore jobStore) {
        this.jobStore = jobStore;
    }

    @Override
    public Health health() {
        Instant startTime = Instant.now();
        try {
            long jobCount = jobStore.count();
            long responseTimeMs = Duration.between(startTime, Instant.now()).toMillis();

            Health.Builder builder;
            if (responseTimeMs <= GOOD_RESPONSE_TIME_MS) {
                builder = Health.up();
            } else if (responseTimeMs <= WARNING_RESPONSE_TIME_MS) {
                builder = Health.status("WARNING");
            } else {
                builder = Health.status("SLOW");
            }
            return builder
                    .withDetail("store", jobStore.getClass().getSimpleName())
                    .withDetail("jobs", jobCount)
                    .withDetail("response_time_ms", responseTimeMs)
                    .build();
        } catch (Exception e) {
            logger.error("Job store health check failed: {}", e.getMessage());
            return Health.down()
                    .withDetail("store", jobStore.getClass().getSimpleName())
                    .withDetail("error", e.getMessage())
                    .build();
        }
    }
}
