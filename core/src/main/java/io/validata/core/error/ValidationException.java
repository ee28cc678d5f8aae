package io.validata.core.error;

/**
 * Abstract base for all validata exceptions. Never thrown directly; use the concrete subclasses.
 * Ordinary invalid input never raises one of these; it produces a non-empty report instead.
 */
public abstract class ValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Stage of a validation call in which the error occurred. */
    public enum Phase {
        BINDING,
        EVALUATION,
        DEPENDENCY,
        CONFIGURATION
    }

    private final String fieldLabel;
    private final Phase phase;

    protected ValidationException(String message, String fieldLabel, Phase phase) {
        super(message);
        this.fieldLabel = fieldLabel;
        this.phase = phase;
    }

    protected ValidationException(String message, Throwable cause, String fieldLabel, Phase phase) {
        super(message, cause);
        this.fieldLabel = fieldLabel;
        this.phase = phase;
    }

    /** Wire-label of the field that triggered the error, or {@code null} if not field-specific. */
    public String fieldLabel() {
        return fieldLabel;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
