package io.validata.core.error;

/**
 * Thrown when the uniqueness store cannot answer an existence query (connection refused, bad
 * table, SQL error). Unlike field faults this aborts the validation call, after sibling fields
 * have finished, so callers can tell "value taken" apart from "store unavailable".
 */
public final class UniquenessCheckException extends ValidationException {

    private static final long serialVersionUID = 1L;

    public UniquenessCheckException(String message, String fieldLabel) {
        super(message, fieldLabel, Phase.DEPENDENCY);
    }

    public UniquenessCheckException(String message, Throwable cause, String fieldLabel) {
        super(message, cause, fieldLabel, Phase.DEPENDENCY);
    }
}
