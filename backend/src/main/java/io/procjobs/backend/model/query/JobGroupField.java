package io.procjobs.backend.model.query;

import io.procjobs.backend.model.entity.Job;

import java.util.Locale;
import java.util.Optional;

/**
 * Job fields a listing can be partitioned by.
 */
public enum JobGroupField {
    PROCESS("process"),
    SERVICE("service"),
    STATUS("status"),
    USER("user"),
    ACCESS("access");

    private final String value;

    JobGroupField(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public Object extract(Job job) {
        switch (this) {
            case PROCESS:
                return job.getProcessId();
            case SERVICE:
                return job.getServiceId();
            case STATUS:
                return job.getStatus().getValue();
            case USER:
                return job.getUserId();
            case ACCESS:
                return job.getAccess().getValue();
            default:
                throw new IllegalStateException("Unhandled group field " + this);
        }
    }

    /**
     * Resolves a requested group name; {@code provider} is an alias of {@link #SERVICE}.
     */
    public static Optional<JobGroupField> resolve(String candidate) {
        if (candidate == null) {
            return Optional.empty();
        }
        String normalized = candidate.trim().toLowerCase(Locale.ROOT);
        if ("provider".equals(normalized)) {
            return Optional.of(SERVICE);
        }
        for (JobGroupField field : values()) {
            if (field.value.equals(normalized)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}
