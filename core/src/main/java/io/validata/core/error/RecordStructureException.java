package io.validata.core.error;

/**
 * Thrown when the argument handed to the engine is not a record: {@code null}, a scalar, a
 * collection, a cyclic object graph or a type whose fields cannot be read. Raised before any field
 * is evaluated.
 */
public final class RecordStructureException extends ValidationException {

    private static final long serialVersionUID = 1L;

    public RecordStructureException(String message) {
        super(message, null, Phase.BINDING);
    }

    public RecordStructureException(String message, String fieldLabel) {
        super(message, fieldLabel, Phase.BINDING);
    }

    public RecordStructureException(String message, Throwable cause, String fieldLabel) {
        super(message, cause, fieldLabel, Phase.BINDING);
    }
}
