package io.procjobs.backend.model.dto;

import io.procjobs.backend.model.entity.Access;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Everything needed to register a new job, assembled by the execution service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobCreateRequest {

    /**
     * Runner correlation id, required
     */
    private String taskReference;

    private String processId;

    /**
     * Remote provider, null for local processes
     */
    private String serviceId;

    private boolean workflow;

    private Map<String, Object> inputs;

    private String userId;

    /**
     * Visibility, private when not given
     */
    private Access access;

    private boolean executeAsync;

    /**
     * Creation time, current time when not given
     */
    private Instant created;

    private List<String> tags;

    /**
     * Plain notification contact; encoded before it is stored
     */
    private String notificationContact;

    private String acceptLanguage;

    private String contextCorrelationId;
}
