package io.procjobs.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Problem details returned with every 4xx/5xx response
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    /**
     * Short machine-readable error kind, e.g. "InvalidParameterValue"
     */
    private String type;

    private String title;

    private String detail;

    private int status;

    /**
     * Offending parameter or field, when one can be named
     */
    private String field;

    /**
     * Offending raw value
     */
    private String value;
}
