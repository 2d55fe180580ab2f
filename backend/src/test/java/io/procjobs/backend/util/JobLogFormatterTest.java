package io.procjobs.backend.util;

import io.procjobs.backend.model.entity.Job;
import io.procjobs.backend.model.entity.JobStatus;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class JobLogFormatterTest {

    private static final Instant CREATED = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void formatLine_AcceptedJob_ShouldUsePaddedColumns() {
        Job job = new Job("job-1", "task-1", "ndvi", CREATED);

        String line = JobLogFormatter.formatLine(job, "hello", "info", CREATED.plusSeconds(3));

        assertThat(line).isEqualTo("[2024-05-01 10:00:03] INFO     [job] 00:00:00   0% accepted   hello");
    }

    @Test
    void formatLine_RunningJob_ShouldIncludeElapsedTimeAndProgress() {
        Job job = new Job("job-1", "task-1", "ndvi", CREATED);
        job.updateStatus(JobStatus.RUNNING, CREATED.plusSeconds(1));
        job.updateProgress(40);

        String line = JobLogFormatter.formatLine(job, "Fetching inputs", null, CREATED.plusSeconds(66));

        assertThat(line).isEqualTo("[2024-05-01 10:01:06] INFO     [job] 00:01:05  40% running    Fetching inputs");
    }

    @Test
    void formatDuration_ShouldKeepCountingHoursPastOneDay() {
        assertThat(JobLogFormatter.formatDuration(Duration.ofHours(26).plusMinutes(3).plusSeconds(9)))
                .isEqualTo("26:03:09");
        assertThat(JobLogFormatter.formatDuration(null)).isEqualTo("00:00:00");
        assertThat(JobLogFormatter.formatDuration(Duration.ofSeconds(-5))).isEqualTo("00:00:00");
    }
}
