package io.procjobs.backend.repository;

import io.procjobs.backend.model.entity.Job;
import io.procjobs.backend.model.entity.JobStatus;
import io.procjobs.backend.model.query.GroupBy;
import io.procjobs.backend.model.query.JobGroup;
import io.procjobs.backend.model.query.JobGroupField;
import io.procjobs.backend.model.query.JobPage;
import io.procjobs.backend.model.query.JobSearchCriteria;
import io.procjobs.backend.model.query.JobSortField;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class InMemoryJobStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private InMemoryJobStore jobStore;

    @BeforeEach
    void setUp() {
        jobStore = new InMemoryJobStore(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void save_MutatedAfterwards_ShouldKeepStoredSnapshot() {
        // Given
        Job job = job("a", "ndvi", 1);
        jobStore.save(job);

        // When
        job.updateStatus(JobStatus.RUNNING, NOW);

        // Then
        assertThat(jobStore.findById("a").orElseThrow().getStatus()).isEqualTo(JobStatus.ACCEPTED);
    }

    @Test
    void search_SortByFinished_ShouldPutUnfinishedLast() {
        // Given
        Job early = job("a", "ndvi", 1);
        early.updateStatus(JobStatus.FAILED, NOW.minusSeconds(300));
        Job late = job("b", "ndvi", 2);
        late.updateStatus(JobStatus.FAILED, NOW.minusSeconds(60));
        jobStore.save(early);
        jobStore.save(late);
        jobStore.save(job("c", "ndvi", 3));

        // When
        JobPage page = jobStore.search(JobSearchCriteria.builder().build(), JobSortField.FINISHED, 0, 10);

        // Then
        assertThat(page.getJobs()).extracting(Job::getId).containsExactly("b", "a", "c");
    }

    @Test
    void search_StatusFilterAndWindow_ShouldCountAllMatches() {
        for (int i = 0; i < 5; i++) {
            jobStore.save(job("job-" + i, "ndvi", i));
        }
        Job failed = job("job-x", "ndvi", 9);
        failed.updateStatus(JobStatus.FAILED, NOW);
        jobStore.save(failed);

        JobPage page = jobStore.search(JobSearchCriteria.builder().status(JobStatus.ACCEPTED).build(),
                JobSortField.ID, 1, 2);

        assertThat(page.getTotal()).isEqualTo(5);
        assertThat(page.getJobs()).extracting(Job::getId).containsExactly("job-2", "job-3");
    }

    @Test
    void group_ByProcess_ShouldPartitionInSortOrder() {
        jobStore.save(job("a", "ndvi", 1));
        jobStore.save(job("b", "cat", 2));
        jobStore.save(job("c", "ndvi", 3));

        List<JobGroup> groups = jobStore.group(JobSearchCriteria.builder().build(), JobSortField.CREATED,
                List.of(new GroupBy(JobGroupField.PROCESS, "process")));

        assertThat(groups).hasSize(2);
        assertThat(groups.get(0).getCategory()).containsEntry("process", "ndvi");
        assertThat(groups.get(0).getJobs()).extracting(Job::getId).containsExactly("c", "a");
        assertThat(groups.get(1).getCount()).isEqualTo(1);
    }

    @Test
    void delete_UnknownJob_ShouldReturnFalse() {
        jobStore.save(job("a", "ndvi", 1));

        assertThat(jobStore.delete("missing")).isFalse();
        assertThat(jobStore.delete("a")).isTrue();
        assertThat(jobStore.count()).isZero();
    }

    private static Job job(String id, String processId, int minute) {
        return new Job(id, "task-" + id, processId, NOW.minusSeconds(3600).plusSeconds(minute * 60L));
    }
}
