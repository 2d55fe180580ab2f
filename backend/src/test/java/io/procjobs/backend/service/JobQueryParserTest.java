package io.procjobs.backend.service;

import io.procjobs.backend.model.entity.Access;
import io.procjobs.backend.model.entity.JobStatus;
import io.procjobs.backend.model.query.DatetimeInterval;
import io.procjobs.backend.model.query.GroupBy;
import io.procjobs.backend.model.query.JobGroupField;
import io.procjobs.backend.model.query.JobListContext;
import io.procjobs.backend.model.query.JobQuery;
import io.procjobs.backend.model.query.JobSortField;
import io.procjobs.backend.model.query.JobType;
import io.procjobs.backend.service.exception.InvalidJobQueryException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for JobQueryParser
 * Tests parameter parsing and the 400/422 split of rejected values
 */
class JobQueryParserTest {

    private JobQueryParser parser;

    @BeforeEach
    void setUp() {
        parser = new JobQueryParser(10);
    }

    @Test
    void parse_NoParameters_ShouldUseDefaults() {
        JobQuery query = parser.parse(params(), JobListContext.global());

        assertThat(query.getPage()).isZero();
        assertThat(query.getLimit()).isEqualTo(10);
        assertThat(query.getSort()).isEqualTo(JobSortField.CREATED);
        assertThat(query.getStatuses()).isEmpty();
        assertThat(query.isGrouped()).isFalse();
        assertThat(query.getParameters()).isEmpty();
    }

    @Test
    void parse_FullFilterSet_ShouldPopulateQuery() {
        // Given
        MultiValueMap<String, String> params = params(
                "process", "ndvi",
                "provider", "hummingbird",
                "type", "provider",
                "status", "running,succeeded",
                "tags", "workflow,async",
                "access", "private",
                "minDuration", "10",
                "maxDuration", "60",
                "sort", "finished",
                "page", "2",
                "limit", "5");

        // When
        JobQuery query = parser.parse(params, JobListContext.global());

        // Then
        assertThat(query.getProcessId()).isEqualTo("ndvi");
        assertThat(query.getServiceId()).isEqualTo("hummingbird");
        assertThat(query.getJobType()).isEqualTo(JobType.PROVIDER);
        assertThat(query.getStatuses()).containsExactlyInAnyOrder(JobStatus.RUNNING, JobStatus.SUCCEEDED);
        assertThat(query.getTags()).containsExactly("workflow", "async");
        assertThat(query.getAccess()).isEqualTo(Access.PRIVATE);
        assertThat(query.getMinDuration()).isEqualTo(10L);
        assertThat(query.getMaxDuration()).isEqualTo(60L);
        assertThat(query.getSort()).isEqualTo(JobSortField.FINISHED);
        assertThat(query.getPage()).isEqualTo(2);
        assertThat(query.getLimit()).isEqualTo(5);
        assertThat(query.getParameters()).containsOnlyKeys(
                "process", "provider", "type", "status", "tags", "access", "minDuration", "maxDuration", "sort");
    }

    @Test
    void parse_StatusCategory_ShouldExpandToMembers() {
        JobQuery query = parser.parse(params("status", "finished"), JobListContext.global());

        assertThat(query.getStatuses())
                .containsExactlyInAnyOrder(JobStatus.SUCCEEDED, JobStatus.FAILED, JobStatus.DISMISSED);
    }

    @Test
    void parse_LiteralStatusNamedLikeCategory_ShouldPreferLiteral() {
        JobQuery query = parser.parse(params("status", "running"), JobListContext.global());

        assertThat(query.getStatuses()).containsExactly(JobStatus.RUNNING);
    }

    @Test
    void parse_ServiceAndProviderAliases_ShouldAgree() {
        assertThat(parser.parse(params("service", "hummingbird"), JobListContext.global()).getServiceId())
                .isEqualTo("hummingbird");

        assertThatThrownBy(() -> parser.parse(params("service", "a", "provider", "b"), JobListContext.global()))
                .isInstanceOf(InvalidJobQueryException.class)
                .hasFieldOrPropertyWithValue("kind", InvalidJobQueryException.Kind.MALFORMED);
    }

    @Test
    void parse_ScopedContext_ShouldTakeIdentifiersFromPath() {
        // Given
        JobListContext context = JobListContext.providerProcess("hummingbird", "subset");

        // When
        JobQuery query = parser.parse(params("process", "subset", "status", "accepted"), context);

        // Then
        assertThat(query.getProcessId()).isEqualTo("subset");
        assertThat(query.getServiceId()).isEqualTo("hummingbird");
        assertThat(query.getParameters()).containsOnlyKeys("status");
    }

    @Test
    void parse_ProcessContradictingPath_ShouldBeMalformed() {
        assertThatThrownBy(() -> parser.parse(params("process", "other"), JobListContext.process("ndvi")))
                .isInstanceOf(InvalidJobQueryException.class)
                .hasFieldOrPropertyWithValue("field", "process")
                .hasFieldOrPropertyWithValue("kind", InvalidJobQueryException.Kind.MALFORMED);
    }

    @Test
    void parse_ProcessTypeWithProvider_ShouldBeMalformed() {
        assertThatThrownBy(() -> parser.parse(params("type", "process", "provider", "hummingbird"),
                JobListContext.global()))
                .isInstanceOf(InvalidJobQueryException.class)
                .hasFieldOrPropertyWithValue("field", "type");

        assertThatThrownBy(() -> parser.parse(params("type", "process"), JobListContext.provider("hummingbird")))
                .isInstanceOf(InvalidJobQueryException.class)
                .hasFieldOrPropertyWithValue("kind", InvalidJobQueryException.Kind.MALFORMED);
    }

    @ParameterizedTest
    @CsvSource({
            "page, abc, MALFORMED",
            "page, -1, MALFORMED",
            "limit, 0, MALFORMED",
            "type, workflow, MALFORMED",
            "access, protected, MALFORMED",
            "groups, color, MALFORMED",
            "tags, public, MALFORMED",
            "minDuration, soon, MALFORMED",
            "maxDuration, -5, MALFORMED",
            "status, bogus, UNPROCESSABLE",
            "sort, quality, UNPROCESSABLE",
            "datetime, yesterday, UNPROCESSABLE",
            "datetime, 2024-05-02T00:00:00Z/2024-05-01T00:00:00Z, UNPROCESSABLE",
            "datetime, ../.., UNPROCESSABLE"
    })
    void parse_InvalidValue_ShouldReportKind(String name, String value, InvalidJobQueryException.Kind kind) {
        assertThatThrownBy(() -> parser.parse(params(name, value), JobListContext.global()))
                .isInstanceOf(InvalidJobQueryException.class)
                .hasFieldOrPropertyWithValue("field", name)
                .hasFieldOrPropertyWithValue("kind", kind);
    }

    @Test
    void parse_InvertedDurationRange_ShouldBeUnprocessable() {
        assertThatThrownBy(() -> parser.parse(params("minDuration", "60", "maxDuration", "10"), JobListContext.global()))
                .isInstanceOf(InvalidJobQueryException.class)
                .hasFieldOrPropertyWithValue("kind", InvalidJobQueryException.Kind.UNPROCESSABLE);
    }

    @Test
    void parse_Groups_ShouldResolveAliasAndKeepRequestedLabel() {
        // When
        JobQuery query = parser.parse(params("groups", "provider,status,service", "page", "3"), JobListContext.global());

        // Then
        assertThat(query.isGrouped()).isTrue();
        assertThat(query.getGroups()).containsExactly(
                new GroupBy(JobGroupField.SERVICE, "provider"),
                new GroupBy(JobGroupField.STATUS, "status"));
        assertThat(query.getPage()).isZero();
    }

    @Test
    void parseDatetime_OpenEndedForms_ShouldBuildInterval() {
        Instant start = Instant.parse("2024-05-01T00:00:00Z");
        Instant end = Instant.parse("2024-05-02T00:00:00Z");

        assertThat(JobQueryParser.parseDatetime("2024-05-01T00:00:00Z")).isEqualTo(DatetimeInterval.exactly(start));
        assertThat(JobQueryParser.parseDatetime("../2024-05-02T00:00:00Z")).isEqualTo(DatetimeInterval.between(null, end));
        assertThat(JobQueryParser.parseDatetime("2024-05-01T00:00:00Z/..")).isEqualTo(DatetimeInterval.between(start, null));
        assertThat(JobQueryParser.parseDatetime("2024-05-01T00:00:00Z/2024-05-02T00:00:00Z"))
                .isEqualTo(DatetimeInterval.between(start, end));
    }

    @Test
    void parseDatetime_OffsetWithDecodedPlus_ShouldBeRestored() {
        DatetimeInterval interval = JobQueryParser.parseDatetime("2024-05-01T02:00:00 02:00");

        assertThat(interval.getMatch()).isEqualTo(Instant.parse("2024-05-01T00:00:00Z"));
    }

    @Test
    void parseDatetime_WithoutOffset_ShouldAssumeUtc() {
        DatetimeInterval interval = JobQueryParser.parseDatetime("2024-05-01T08:30:00");

        assertThat(interval.getMatch()).isEqualTo(Instant.parse("2024-05-01T08:30:00Z"));
    }

    private static MultiValueMap<String, String> params(String... keyValues) {
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            params.add(keyValues[i], keyValues[i + 1]);
        }
        return params;
    }
}
