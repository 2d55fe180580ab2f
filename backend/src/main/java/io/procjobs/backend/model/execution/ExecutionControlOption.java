package io.procjobs.backend.model.execution;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Job control options a process declares in its description.
 * Only the execute options take part in execution-mode negotiation.
 */
public enum ExecutionControlOption {
    SYNC_EXECUTE("sync-execute"),
    ASYNC_EXECUTE("async-execute"),
    DISMISS("dismiss");

    private final String value;

    ExecutionControlOption(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ExecutionControlOption fromValue(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (ExecutionControlOption option : values()) {
            if (option.value.equals(normalized) || option.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return option;
            }
        }
        throw new IllegalArgumentException("Unknown job control option: " + value);
    }
}
