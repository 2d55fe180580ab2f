package io.procjobs.backend.model.execution;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ExecutionMode {
    SYNC("sync"),
    ASYNC("async");

    private final String value;

    ExecutionMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
