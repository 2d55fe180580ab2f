package io.procjobs.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Hypermedia link of a job or job list response.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Link {

    private String href;

    private String rel;

    @Builder.Default
    private String type = "application/json";

    private String title;

    public static Link of(String rel, String href, String title) {
        return Link.builder().rel(rel).href(href).title(title).build();
    }
}
