package io.procjobs.backend.model.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Buckets of {@link JobStatus} used for filtering and state-machine reasoning.
 * Always derived from the status, never stored.
 */
public enum StatusCategory {
    ACCEPTED("accepted"),
    RUNNING("running"),
    FINISHED_SUCCESS("finished-success"),
    FINISHED_FAILURE("finished-failure");

    private final String value;

    StatusCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isFinished() {
        return this == FINISHED_SUCCESS || this == FINISHED_FAILURE;
    }

    /**
     * Expands a named filter category to its member statuses.
     * Besides the category values themselves, {@code finished} covers every terminal status
     * and {@code pending} covers everything still in progress.
     *
     * @param name category name as supplied in a query
     * @return member statuses, empty if the name is not a category
     */
    public static Optional<Set<JobStatus>> expand(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "finished":
                return Optional.of(EnumSet.of(JobStatus.SUCCEEDED, JobStatus.FAILED, JobStatus.DISMISSED));
            case "pending":
                return Optional.of(EnumSet.of(JobStatus.ACCEPTED, JobStatus.RUNNING));
            default:
                break;
        }
        for (StatusCategory category : values()) {
            if (category.value.equals(normalized)) {
                EnumSet<JobStatus> members = EnumSet.noneOf(JobStatus.class);
                for (JobStatus status : JobStatus.values()) {
                    if (status.getCategory() == category) {
                        members.add(status);
                    }
                }
                return Optional.of(members);
            }
        }
        return Optional.empty();
    }
}
