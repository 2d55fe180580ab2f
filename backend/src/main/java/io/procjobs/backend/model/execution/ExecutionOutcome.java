package io.procjobs.backend.model.execution;

import io.procjobs.backend.model.entity.Job;
import lombok.Value;

/**
 * Result of a submission: the job as last observed and how it was handled.
 */
@Value
public class ExecutionOutcome {

    Job job;
    ExecutionModeDecision decision;

    /**
     * True when a synchronous wait saw the job finish
     */
    boolean completed;
}
