package io.procjobs.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobGroupResponse {

    /**
     * Requested group field name to the value shared by the group
     */
    private Map<String, Object> category;

    private List<Object> jobs;

    private int count;
}
