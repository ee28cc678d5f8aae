package io.validata.core.error;

/**
 * Thrown when a rule cannot be evaluated, e.g. a non-numeric bound in {@code min:abc} or a range
 * rule with a single bound. Caught at the field task boundary and rendered as that field's outcome.
 */
public final class RuleEvaluationException extends ValidationException {

    private static final long serialVersionUID = 1L;

    private final String rule;

    public RuleEvaluationException(String message, String rule) {
        super(message, null, Phase.EVALUATION);
        this.rule = rule;
    }

    public RuleEvaluationException(String message, Throwable cause, String rule) {
        super(message, cause, null, Phase.EVALUATION);
        this.rule = rule;
    }

    /** The rule token (without override message) that failed, or {@code null}. */
    public String rule() {
        return rule;
    }
}
