package io.procjobs.backend.model.execution;

import io.procjobs.backend.model.entity.Access;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * The parts of a registered process description that job handling needs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessDescription {

    private String id;

    /**
     * Remote provider hosting the process, null for local processes
     */
    private String providerId;

    private String title;

    private boolean workflow;

    /**
     * Declared options; null means the process did not restrict them
     */
    private Set<ExecutionControlOption> jobControlOptions;

    @Builder.Default
    private Access visibility = Access.PUBLIC;

    /**
     * Reference used to reach the runner, e.g. the package or image name
     */
    private String executionUnit;
}
