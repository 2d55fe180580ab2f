package io.procjobs.backend.model.entity;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Job
 * Tests field validation and the status state machine
 */
class JobTest {

    private static final Instant CREATED = Instant.parse("2024-05-01T10:00:00Z");

    private Job job;

    @BeforeEach
    void setUp() {
        job = new Job("job-1", "task-1", "ndvi", CREATED);
    }

    @Test
    void constructor_NewJob_ShouldStartAccepted() {
        assertThat(job.getStatus()).isEqualTo(JobStatus.ACCEPTED);
        assertThat(job.getStatusCategory()).isEqualTo(StatusCategory.ACCEPTED);
        assertThat(job.getAccess()).isEqualTo(Access.PRIVATE);
        assertThat(job.getCreated()).isEqualTo(CREATED);
        assertThat(job.getStarted()).isNull();
        assertThat(job.getFinished()).isNull();
        assertThat(job.getDuration(CREATED.plusSeconds(60))).isEqualTo(Duration.ZERO);
    }

    @Test
    void constructor_MissingTaskReference_ShouldThrowException() {
        assertThatThrownBy(() -> new Job("job-2", " ", "ndvi", CREATED))
                .isInstanceOf(InvalidJobFieldException.class)
                .hasFieldOrPropertyWithValue("field", "taskReference");
    }

    @Test
    void updateStatus_RunningThenSucceeded_ShouldSetTimestampsOnce() {
        // Given
        Instant started = CREATED.plusSeconds(5);
        Instant finished = started.plusSeconds(65);

        // When
        job.updateStatus(JobStatus.RUNNING, started);
        job.updateStatus(JobStatus.SUCCEEDED, finished);

        // Then
        assertThat(job.getStarted()).isEqualTo(started);
        assertThat(job.getFinished()).isEqualTo(finished);
        assertThat(job.getStatusCategory()).isEqualTo(StatusCategory.FINISHED_SUCCESS);
        assertThat(job.getDuration(finished.plusSeconds(3600))).isEqualTo(Duration.ofSeconds(65));
    }

    @Test
    void updateStatus_SameTerminalStatusAgain_ShouldBeNoOp() {
        // Given
        Instant finished = CREATED.plusSeconds(10);
        job.updateStatus(JobStatus.RUNNING, CREATED);
        job.updateStatus(JobStatus.FAILED, finished);

        // When
        boolean changed = job.updateStatus(JobStatus.FAILED, finished.plusSeconds(30));

        // Then
        assertThat(changed).isFalse();
        assertThat(job.getFinished()).isEqualTo(finished);
    }

    @Test
    void updateStatus_OutOfTerminalStatus_ShouldThrowConflict() {
        job.updateStatus(JobStatus.DISMISSED, CREATED.plusSeconds(1));

        assertThatThrownBy(() -> job.updateStatus(JobStatus.RUNNING, CREATED.plusSeconds(2)))
                .isInstanceOf(JobStateConflictException.class);
        assertThat(job.getStatus()).isEqualTo(JobStatus.DISMISSED);
    }

    @Test
    void updateStatus_AcceptedToSucceeded_ShouldThrowConflict() {
        assertThatThrownBy(() -> job.updateStatus(JobStatus.SUCCEEDED, CREATED))
                .isInstanceOf(JobStateConflictException.class);
    }

    @Test
    void updateStatus_FailedBeforeRunning_ShouldKeepZeroDuration() {
        job.updateStatus(JobStatus.FAILED, CREATED.plusSeconds(3));

        assertThat(job.getFinished()).isEqualTo(CREATED.plusSeconds(3));
        assertThat(job.getDuration()).isEqualTo(Duration.ZERO);
    }

    @Test
    void updateProgress_OutOfRange_ShouldKeepPreviousValue() {
        job.updateProgress(40);

        assertThatThrownBy(() -> job.updateProgress(101))
                .isInstanceOf(InvalidJobFieldException.class);
        assertThatThrownBy(() -> job.updateProgress(-1))
                .isInstanceOf(InvalidJobFieldException.class);
        assertThat(job.getProgress()).isEqualTo(40);
    }

    @Test
    void updateProgress_SameValue_ShouldReportUnchanged() {
        assertThat(job.updateProgress(25)).isTrue();
        assertThat(job.updateProgress(25)).isFalse();
    }

    @Test
    void appendLog_RepeatedLine_ShouldBeDropped() {
        assertThat(job.appendLog("line one")).isTrue();
        assertThat(job.appendLog("line one")).isFalse();
        assertThat(job.appendLog("line two")).isTrue();
        assertThat(job.appendLog("line one")).isTrue();

        assertThat(job.getLogs()).containsExactly("line one", "line two", "line one");
    }

    @Test
    void setAccess_InvalidValue_ShouldThrowException() {
        assertThatThrownBy(() -> job.setAccess("protected"))
                .isInstanceOf(InvalidJobFieldException.class);
        assertThat(job.getAccess()).isEqualTo(Access.PRIVATE);

        job.setAccess("PUBLIC");
        assertThat(job.getAccess()).isEqualTo(Access.PUBLIC);
    }

    @Test
    void clearArtifactResults_MixedResults_ShouldKeepLiteralValues() {
        // Given
        JobOutput artifact = JobOutput.builder().id("output").href("https://data/out.tif").build();
        JobOutput literal = JobOutput.builder().id("count").value(42).build();
        job.addResult(artifact);
        job.addResult(literal);

        // When
        List<JobOutput> removed = job.clearArtifactResults();

        // Then
        assertThat(removed).containsExactly(artifact);
        assertThat(job.getResults()).containsExactly(literal);
    }

    @Test
    void addTags_BlankTag_ShouldThrowException() {
        assertThatThrownBy(() -> job.addTags(List.of("ok", " ")))
                .isInstanceOf(InvalidJobFieldException.class);
    }
}
