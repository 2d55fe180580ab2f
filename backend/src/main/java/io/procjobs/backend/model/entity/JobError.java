package io.procjobs.backend.model.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Structured error reported by the runner for a job.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobError {

    /**
     * Error code, e.g. "NoApplicableCode" or an exception class name
     */
    private String code;

    /**
     * Where the error occurred (input id, step name...)
     */
    private String locator;

    private String text;
}
