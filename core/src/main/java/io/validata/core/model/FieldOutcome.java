package io.validata.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of evaluating one field's rule chain. Exactly one of:
 *
 * <ul>
 * <li>{@link Type#PASSED}: every rule held; nothing is reported.
 * <li>{@link Type#VIOLATION}: a rule failed; {@code messageKey} and the rendered {@code message}.
 * <li>{@link Type#NESTED}: the field's sub-record produced a non-empty report.
 * <li>{@link Type#ELEMENTS}: one or more sequence elements failed; ordered messages/reports.
 * <li>{@link Type#FAULT}: evaluation itself failed; {@code message} carries the fault detail.
 * </ul>
 */
public final class FieldOutcome {

    /** The type of field outcome. */
    public enum Type {
        PASSED,
        VIOLATION,
        NESTED,
        ELEMENTS,
        FAULT
    }

    private final Type type;
    private final String label;
    private final String messageKey;
    private final Object message;

    private FieldOutcome(Type type, String label, String messageKey, Object message) {
        this.type = type;
        this.label = Objects.requireNonNull(label, "label must not be null");
        this.messageKey = messageKey;
        this.message = message;
    }

    public static FieldOutcome passed(String label) {
        return new FieldOutcome(Type.PASSED, label, null, null);
    }

    /**
     * @param messageKey the rule's message key, e.g. {@code min.string}
     * @param message    the rendered (or overriding) message
     */
    public static FieldOutcome violation(String label, String messageKey, String message) {
        Objects.requireNonNull(message, "message must not be null for VIOLATION");
        return new FieldOutcome(Type.VIOLATION, label, messageKey, message);
    }

    public static FieldOutcome nested(String label, ValidationReport report) {
        Objects.requireNonNull(report, "report must not be null for NESTED");
        return new FieldOutcome(Type.NESTED, label, null, report);
    }

    /** @param entries element messages ({@code String}) and element reports, in element order */
    public static FieldOutcome elements(String label, List<Object> entries) {
        Objects.requireNonNull(entries, "entries must not be null for ELEMENTS");
        return new FieldOutcome(Type.ELEMENTS, label, null, List.copyOf(entries));
    }

    public static FieldOutcome fault(String label, String detail) {
        return new FieldOutcome(Type.FAULT, label, "fault", detail);
    }

    public Type type() {
        return type;
    }

    /** Wire-label of the field; the report key. */
    public String label() {
        return label;
    }

    /** Message key for VIOLATION and FAULT outcomes, {@code null} otherwise. */
    public String messageKey() {
        return messageKey;
    }

    /**
     * Report payload: a {@code String} for VIOLATION and FAULT, a {@link ValidationReport} for
     * NESTED, a {@code List<Object>} for ELEMENTS, {@code null} for PASSED.
     */
    public Object message() {
        return message;
    }

    public boolean isPassed() {
        return type == Type.PASSED;
    }

    public boolean isFault() {
        return type == Type.FAULT;
    }

    @Override
    public String toString() {
        return switch (type) {
            case PASSED -> "FieldOutcome[PASSED, " + label + "]";
            case VIOLATION -> "FieldOutcome[VIOLATION, " + label + ", key=" + messageKey + "]";
            case NESTED -> "FieldOutcome[NESTED, " + label + "]";
            case ELEMENTS -> "FieldOutcome[ELEMENTS, " + label + ", count=" + ((List<?>) message).size() + "]";
            case FAULT -> "FieldOutcome[FAULT, " + label + "]";
        };
    }
}
