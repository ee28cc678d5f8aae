package io.validata.core.engine.predicate;

import io.validata.core.error.RuleEvaluationException;
import io.validata.core.model.Value;
import java.nio.charset.StandardCharsets;

/**
 * Bound checks: {@code min}, {@code max}, {@code equal}/{@code size}, {@code between} and
 * {@code from}.
 *
 * <p>
 * The measured quantity depends on the kind: UTF-8 byte length for text, element count for
 * sequences, and the value itself for numbers. Bounds are parsed for the kind (int for lengths,
 * signed or unsigned 64-bit, double); a bound that does not parse raises
 * {@link RuleEvaluationException}. Kinds without a measure never violate.
 *
 * <p>
 * Float comparisons are written so that NaN, on either side, always violates.
 */
public final class ComparativePredicates {

    private static final int NOT_APPLICABLE = Integer.MIN_VALUE;
    private static final int UNORDERED = Integer.MAX_VALUE;

    private ComparativePredicates() {}

    /** Violates when the measure is below {@code bound}. */
    public static boolean isNotMin(Value value, String bound, String rule) {
        int c = compare(value, bound, rule);
        return c != NOT_APPLICABLE && (c == UNORDERED || c < 0);
    }

    /** Violates when the measure is above {@code bound}. */
    public static boolean isNotMax(Value value, String bound, String rule) {
        int c = compare(value, bound, rule);
        return c != NOT_APPLICABLE && (c == UNORDERED || c > 0);
    }

    /** Violates unless the measure equals {@code bound}. Also used by {@code size}. */
    public static boolean isNotEqual(Value value, String bound, String rule) {
        int c = compare(value, bound, rule);
        return c != NOT_APPLICABLE && c != 0;
    }

    /** Exclusive range: violates unless {@code min < x < max}. */
    public static boolean isNotBetween(Value value, String min, String max, String rule) {
        int lower = compare(value, min, rule);
        int upper = compare(value, max, rule);
        if (lower == NOT_APPLICABLE) {
            return false;
        }
        if (lower == UNORDERED || upper == UNORDERED) {
            return true;
        }
        return lower <= 0 || upper >= 0;
    }

    /** Inclusive range: violates unless {@code min <= x <= max}. */
    public static boolean isNotFrom(Value value, String min, String max, String rule) {
        int lower = compare(value, min, rule);
        int upper = compare(value, max, rule);
        if (lower == NOT_APPLICABLE) {
            return false;
        }
        if (lower == UNORDERED || upper == UNORDERED) {
            return true;
        }
        return lower < 0 || upper > 0;
    }

    /** UTF-8 byte length, the text measure. */
    public static int byteLength(String text) {
        return text.getBytes(StandardCharsets.UTF_8).length;
    }

    // --- Private helpers ---

    private static int compare(Value value, String bound, String rule) {
        if (value instanceof Value.Text text) {
            return Integer.compare(byteLength(text.value()), parseLength(bound, rule));
        }
        if (value instanceof Value.Sequence sequence) {
            return Integer.compare(sequence.size(), parseLength(bound, rule));
        }
        if (value instanceof Value.SignedInt signed) {
            return Long.compare(signed.value(), parseSigned(bound, rule));
        }
        if (value instanceof Value.UnsignedInt unsigned) {
            return Long.compareUnsigned(unsigned.bits(), parseUnsigned(bound, rule));
        }
        if (value instanceof Value.FloatingPoint fp) {
            double limit = parseDouble(bound, rule);
            double x = fp.value();
            if (Double.isNaN(x) || Double.isNaN(limit)) {
                return UNORDERED;
            }
            return x < limit ? -1 : (x > limit ? 1 : 0);
        }
        return NOT_APPLICABLE;
    }

    private static int parseLength(String bound, String rule) {
        try {
            return Integer.parseInt(requireBound(bound, rule));
        } catch (NumberFormatException e) {
            throw invalidBound(bound, rule, e);
        }
    }

    private static long parseSigned(String bound, String rule) {
        try {
            return Long.parseLong(requireBound(bound, rule));
        } catch (NumberFormatException e) {
            throw invalidBound(bound, rule, e);
        }
    }

    private static long parseUnsigned(String bound, String rule) {
        try {
            return Long.parseUnsignedLong(requireBound(bound, rule));
        } catch (NumberFormatException e) {
            throw invalidBound(bound, rule, e);
        }
    }

    private static double parseDouble(String bound, String rule) {
        try {
            return Double.parseDouble(requireBound(bound, rule));
        } catch (NumberFormatException e) {
            throw invalidBound(bound, rule, e);
        }
    }

    private static String requireBound(String bound, String rule) {
        if (bound == null || bound.isEmpty()) {
            throw new RuleEvaluationException("rule '" + rule + "' is missing a bound", rule);
        }
        return bound;
    }

    private static RuleEvaluationException invalidBound(String bound, String rule, NumberFormatException cause) {
        return new RuleEvaluationException("rule '" + rule + "' has an invalid bound '" + bound + "'", cause, rule);
    }
}
