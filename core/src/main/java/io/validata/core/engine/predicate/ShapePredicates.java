package io.validata.core.engine.predicate;

import java.util.regex.Pattern;

/**
 * Character-class checks on text. Each predicate answers "does the value violate the shape?" and
 * matches the whole value.
 */
public final class ShapePredicates {

    private static final Pattern STRING = Pattern.compile("[0-9a-zA-Z+ .-]+");
    private static final Pattern ASCII = Pattern.compile("[\\x00-\\x7F]+");
    private static final Pattern ALPHA = Pattern.compile("[a-zA-Z]+");
    private static final Pattern NUMERIC = Pattern.compile("[0-9]+");
    private static final Pattern ALPHA_NUMERIC = Pattern.compile("[a-zA-Z0-9]+");

    private ShapePredicates() {}

    /** Letters, digits, space, {@code -}, {@code +} and {@code .}. */
    public static boolean isNotString(String value) {
        return !STRING.matcher(value).matches();
    }

    public static boolean isNotAscii(String value) {
        return !ASCII.matcher(value).matches();
    }

    public static boolean isNotAlpha(String value) {
        return !ALPHA.matcher(value).matches();
    }

    public static boolean isNotNumeric(String value) {
        return !NUMERIC.matcher(value).matches();
    }

    public static boolean isNotAlphaNumeric(String value) {
        return !ALPHA_NUMERIC.matcher(value).matches();
    }
}
