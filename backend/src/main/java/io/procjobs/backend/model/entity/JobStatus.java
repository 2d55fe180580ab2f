package io.procjobs.backend.model.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Job processing status.
 * Lookup accepts either the symbolic name or the literal value, case-insensitively,
 * plus the legacy spellings still reported by older runners.
 */
public enum JobStatus {
    ACCEPTED("accepted"),
    RUNNING("running"),
    SUCCEEDED("succeeded"),
    FAILED("failed"),
    DISMISSED("dismissed");

    private static final Map<String, JobStatus> LEGACY_ALIASES = Map.of(
            "started", RUNNING,
            "paused", RUNNING,
            "successful", SUCCEEDED,
            "exception", FAILED
    );

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public StatusCategory getCategory() {
        switch (this) {
            case ACCEPTED:
                return StatusCategory.ACCEPTED;
            case RUNNING:
                return StatusCategory.RUNNING;
            case SUCCEEDED:
                return StatusCategory.FINISHED_SUCCESS;
            default:
                return StatusCategory.FINISHED_FAILURE;
        }
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == DISMISSED;
    }

    /**
     * Whether a job currently in this status may move to {@code target}.
     * Re-applying the current status is always allowed and treated as a no-op by callers.
     */
    public boolean canTransitionTo(JobStatus target) {
        if (target == this) {
            return true;
        }
        switch (this) {
            case ACCEPTED:
                return target == RUNNING || target == FAILED || target == DISMISSED;
            case RUNNING:
                return target == SUCCEEDED || target == FAILED || target == DISMISSED;
            default:
                return false;
        }
    }

    /**
     * Resolves a status from client or runner input.
     *
     * @param candidate symbolic name, literal value or legacy alias
     * @return the matching status, empty if the token is not recognized
     */
    public static Optional<JobStatus> resolve(String candidate) {
        if (candidate == null) {
            return Optional.empty();
        }
        String normalized = candidate.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        for (JobStatus status : values()) {
            if (status.value.equals(normalized) || status.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(status);
            }
        }
        return Optional.ofNullable(LEGACY_ALIASES.get(normalized));
    }

    @JsonCreator
    public static JobStatus fromValue(String value) {
        return resolve(value).orElseThrow(() -> new InvalidJobFieldException("status", value));
    }
}
