package io.procjobs.backend.model.query;

import java.util.Locale;
import java.util.Optional;

/**
 * Origin of the process a job ran: local process or remote provider.
 */
public enum JobType {
    PROCESS("process"),
    PROVIDER("provider");

    private final String value;

    JobType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<JobType> resolve(String candidate) {
        if (candidate == null) {
            return Optional.empty();
        }
        String normalized = candidate.trim().toLowerCase(Locale.ROOT);
        for (JobType type : values()) {
            if (type.value.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
