package io.procjobs.backend.model.query;

import io.procjobs.backend.model.entity.Access;
import io.procjobs.backend.model.entity.JobStatus;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validated listing request, as parsed from query parameters.
 */
@Value
@Builder(toBuilder = true)
public class JobQuery {

    public static final int DEFAULT_PAGE = 0;
    public static final int DEFAULT_LIMIT = 10;

    String processId;
    String serviceId;
    JobType jobType;

    /**
     * Accepted statuses, empty when not filtering on status
     */
    @Singular
    Set<JobStatus> statuses;

    @Singular
    Set<String> tags;

    Access access;

    /**
     * Notification contact as supplied by the client, before encoding
     */
    String notification;

    DatetimeInterval datetime;

    /**
     * Inclusive duration bounds in seconds
     */
    Long minDuration;
    Long maxDuration;

    @Singular("groupBy")
    List<GroupBy> groups;

    boolean detail;

    @Builder.Default
    int page = DEFAULT_PAGE;

    @Builder.Default
    int limit = DEFAULT_LIMIT;

    @Builder.Default
    JobSortField sort = JobSortField.CREATED;

    /**
     * Filter parameters as received, in request order, without paging; replayed in links
     */
    @Singular
    Map<String, String> parameters;

    public boolean isGrouped() {
        return !groups.isEmpty();
    }
}
