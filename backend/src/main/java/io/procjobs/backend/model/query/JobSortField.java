package io.procjobs.backend.model.query;

import java.util.Locale;
import java.util.Optional;

/**
 * Allowed sort keys. Time-based keys sort newest first.
 */
public enum JobSortField {
    CREATED("created", true),
    FINISHED("finished", true),
    STATUS("status", false),
    PROCESS("process", false),
    SERVICE("service", false),
    USER("user", false),
    ID("id", false);

    private final String value;
    private final boolean descending;

    JobSortField(String value, boolean descending) {
        this.value = value;
        this.descending = descending;
    }

    public String getValue() {
        return value;
    }

    public boolean isDescending() {
        return descending;
    }

    public static Optional<JobSortField> resolve(String candidate) {
        if (candidate == null) {
            return Optional.empty();
        }
        String normalized = candidate.trim().toLowerCase(Locale.ROOT);
        if ("provider".equals(normalized)) {
            return Optional.of(SERVICE);
        }
        if ("job".equals(normalized) || "jobid".equals(normalized)) {
            return Optional.of(ID);
        }
        for (JobSortField field : values()) {
            if (field.value.equals(normalized)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}
