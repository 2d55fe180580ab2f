package io.procjobs.backend.service.exception;

/**
 * A {@code Prefer} header could not be interpreted, typically a malformed {@code wait} value.
 */
public class InvalidPreferenceException extends RuntimeException {

    private final String rawValue;

    public InvalidPreferenceException(String message, String rawValue) {
        super(message);
        this.rawValue = rawValue;
    }

    public String getRawValue() {
        return rawValue;
    }
}
