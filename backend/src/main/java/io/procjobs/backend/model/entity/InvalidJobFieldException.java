package io.procjobs.backend.model.entity;

/**
 * Thrown when a job field is assigned a value outside its allowed domain.
 * The job keeps its previous value.
 */
public class InvalidJobFieldException extends IllegalArgumentException {

    private final String field;
    private final transient Object rejectedValue;

    public InvalidJobFieldException(String field, Object rejectedValue) {
        super("Invalid value for job field '" + field + "': " + rejectedValue);
        this.field = field;
        this.rejectedValue = rejectedValue;
    }

    public String getField() {
        return field;
    }

    public Object getRejectedValue() {
        return rejectedValue;
    }
}
