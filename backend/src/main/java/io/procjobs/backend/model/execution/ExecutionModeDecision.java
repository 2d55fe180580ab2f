package io.procjobs.backend.model.execution;

import lombok.Value;

import java.util.Collections;
import java.util.Map;

/**
 * How a submission is handled: mode, bounded wait for sync handling,
 * and the response headers echoing the honored preferences.
 */
@Value
public class ExecutionModeDecision {

    public static final String PREFERENCE_APPLIED = "Preference-Applied";

    ExecutionMode mode;

    /**
     * Seconds to wait inline, null for async handling
     */
    Integer waitSeconds;

    Map<String, String> appliedPreferenceHeaders;

    public static ExecutionModeDecision async() {
        return new ExecutionModeDecision(ExecutionMode.ASYNC, null, Collections.emptyMap());
    }

    public static ExecutionModeDecision asyncApplied() {
        return new ExecutionModeDecision(ExecutionMode.ASYNC, null,
                Collections.singletonMap(PREFERENCE_APPLIED, "respond-async"));
    }

    public static ExecutionModeDecision sync(int waitSeconds) {
        return new ExecutionModeDecision(ExecutionMode.SYNC, waitSeconds, Collections.emptyMap());
    }

    public static ExecutionModeDecision syncApplied(int waitSeconds) {
        return new ExecutionModeDecision(ExecutionMode.SYNC, waitSeconds,
                Collections.singletonMap(PREFERENCE_APPLIED, "wait=" + waitSeconds));
    }

    public boolean isSync() {
        return mode == ExecutionMode.SYNC;
    }
}
