package io.procjobs.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Body of a process execution request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExecutionRequest {

    /**
     * Input id to value or reference, passed to the runner as is
     */
    private Map<String, Object> inputs;

    /**
     * Requested visibility of the job: "public" or "private"
     */
    private String access;

    @Size(max = 20)
    private List<String> tags;

    @Email
    private String notificationEmail;
}
