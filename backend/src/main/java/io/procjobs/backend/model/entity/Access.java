package io.procjobs.backend.model.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Visibility of a job to requesters other than its owner.
 */
public enum Access {
    PUBLIC("public"),
    PRIVATE("private");

    private final String value;

    Access(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<Access> resolve(String candidate) {
        if (candidate == null) {
            return Optional.empty();
        }
        String normalized = candidate.trim().toLowerCase(Locale.ROOT);
        for (Access access : values()) {
            if (access.value.equals(normalized) || access.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(access);
            }
        }
        return Optional.empty();
    }

    public static boolean isAccessValue(String candidate) {
        return resolve(candidate).isPresent();
    }

    @JsonCreator
    public static Access fromValue(String value) {
        return resolve(value).orElseThrow(() -> new InvalidJobFieldException("access", value));
    }
}
