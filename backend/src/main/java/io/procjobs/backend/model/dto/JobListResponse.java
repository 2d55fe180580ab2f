package io.procjobs.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Job listing. Paged listings fill {@code jobs}, {@code page} and {@code limit};
 * grouped listings fill {@code groups} instead.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobListResponse {

    /**
     * Job ids, or {@link JobStatusResponse} documents when details were requested
     */
    private List<Object> jobs;

    private List<JobGroupResponse> groups;

    private Integer page;

    private Integer limit;

    private long total;

    private List<Link> links;
}
