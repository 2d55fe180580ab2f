package io.procjobs.backend.model.entity;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

class JobStatusTest {

    @ParameterizedTest
    @CsvSource({
            "accepted, ACCEPTED",
            "RUNNING, RUNNING",
            "Succeeded, SUCCEEDED",
            "started, RUNNING",
            "paused, RUNNING",
            "successful, SUCCEEDED",
            "exception, FAILED",
            "' dismissed ', DISMISSED"
    })
    void resolve_KnownToken_ShouldNormalize(String token, JobStatus expected) {
        assertThat(JobStatus.resolve(token)).contains(expected);
    }

    @Test
    void resolve_UnknownToken_ShouldBeEmpty() {
        assertThat(JobStatus.resolve("finished")).isEmpty();
        assertThat(JobStatus.resolve("")).isEmpty();
        assertThat(JobStatus.resolve(null)).isEmpty();
    }

    @Test
    void fromValue_UnknownToken_ShouldThrowException() {
        assertThatThrownBy(() -> JobStatus.fromValue("bogus"))
                .isInstanceOf(InvalidJobFieldException.class)
                .hasFieldOrPropertyWithValue("rejectedValue", "bogus");
    }

    @Test
    void canTransitionTo_FromTerminal_ShouldOnlyAllowSameStatus() {
        for (JobStatus terminal : new JobStatus[]{JobStatus.SUCCEEDED, JobStatus.FAILED, JobStatus.DISMISSED}) {
            for (JobStatus target : JobStatus.values()) {
                assertThat(terminal.canTransitionTo(target)).isEqualTo(target == terminal);
            }
        }
    }

    @Test
    void getCategory_EachStatus_ShouldMapToBucket() {
        assertThat(JobStatus.ACCEPTED.getCategory()).isEqualTo(StatusCategory.ACCEPTED);
        assertThat(JobStatus.RUNNING.getCategory()).isEqualTo(StatusCategory.RUNNING);
        assertThat(JobStatus.SUCCEEDED.getCategory()).isEqualTo(StatusCategory.FINISHED_SUCCESS);
        assertThat(JobStatus.FAILED.getCategory()).isEqualTo(StatusCategory.FINISHED_FAILURE);
        assertThat(JobStatus.DISMISSED.getCategory()).isEqualTo(StatusCategory.FINISHED_FAILURE);
    }

    @Test
    void expand_NamedCategories_ShouldListMembers() {
        assertThat(StatusCategory.expand("finished").orElseThrow())
                .containsExactlyInAnyOrder(JobStatus.SUCCEEDED, JobStatus.FAILED, JobStatus.DISMISSED);
        assertThat(StatusCategory.expand("pending").orElseThrow())
                .containsExactlyInAnyOrder(JobStatus.ACCEPTED, JobStatus.RUNNING);
        assertThat(StatusCategory.expand("finished-failure").orElseThrow())
                .containsExactlyInAnyOrder(JobStatus.FAILED, JobStatus.DISMISSED);
        assertThat(StatusCategory.expand("succeeded")).isEmpty();
    }
}
