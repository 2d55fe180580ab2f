package io.procjobs.backend.service.exception;

/**
 * A listing parameter was rejected.
 * Malformed values map to 400, values that parse but make no sense (inverted ranges,
 * unknown status or sort tokens) map to 422.
 */
public class InvalidJobQueryException extends RuntimeException {

    public enum Kind {
        MALFORMED,
        UNPROCESSABLE
    }

    private final Kind kind;
    private final String field;
    private final String rawValue;

    public InvalidJobQueryException(Kind kind, String field, String rawValue, String message) {
        super(message);
        this.kind = kind;
        this.field = field;
        this.rawValue = rawValue;
    }

    public static InvalidJobQueryException malformed(String field, String rawValue, String message) {
        return new InvalidJobQueryException(Kind.MALFORMED, field, rawValue, message);
    }

    public static InvalidJobQueryException unprocessable(String field, String rawValue, String message) {
        return new InvalidJobQueryException(Kind.UNPROCESSABLE, field, rawValue, message);
    }

    public Kind getKind() {
        return kind;
    }

    public String getField() {
        return field;
    }

    public String getRawValue() {
        return rawValue;
    }
}
