package io.procjobs.backend.model.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Output descriptor produced by a finished job.
 * Either {@code href} points at a stored artifact or {@code value} carries a literal result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobOutput {

    private String id;

    private String href;

    private Object value;

    private String mediaType;

    @JsonIgnore
    public boolean isArtifact() {
        return href != null && !href.isBlank();
    }
}
