package io.validata.core.engine.predicate;

import io.validata.core.model.Value;
import java.util.Locale;
import java.util.regex.Pattern;

/** Classification of numeric values by their decimal rendering. */
public final class NumericPredicates {

    private static final Pattern INT = Pattern.compile("-?(0|[1-9][0-9]*)");
    // At least two digits: single-digit values are not classified as unsigned.
    private static final Pattern UINT = Pattern.compile("[1-9]\\d+");
    private static final Pattern FLOAT = Pattern.compile("[-+]?[0-9]*\\.?[0-9]+([eE][-+]?[0-9]+)?");

    private NumericPredicates() {}

    public static boolean isNotInt(Value value) {
        return !INT.matcher(value.asText()).matches();
    }

    public static boolean isNotUint(Value value) {
        return !UINT.matcher(value.asText()).matches();
    }

    /** Rendered with two decimals first, so NaN and infinities fail. */
    public static boolean isNotFloat(Value value) {
        if (!(value instanceof Value.FloatingPoint fp)) {
            return !FLOAT.matcher(value.asText()).matches();
        }
        return !FLOAT.matcher(String.format(Locale.ROOT, "%.2f", fp.value())).matches();
    }
}
