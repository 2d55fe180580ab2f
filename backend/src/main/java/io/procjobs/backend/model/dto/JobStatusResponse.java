package io.procjobs.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Status document of a single job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobStatusResponse {

    @JsonProperty("jobID")
    private String jobId;

    @JsonProperty("processID")
    private String processId;

    @JsonProperty("providerID")
    private String providerId;

    /**
     * Always "process", as required by the status document schema
     */
    @Builder.Default
    private String type = "process";

    private String status;

    private String message;

    private Instant created;

    private Instant started;

    private Instant finished;

    /**
     * Elapsed run time as HH:MM:SS
     */
    private String duration;

    private Integer percentCompleted;

    private List<Link> links;
}
