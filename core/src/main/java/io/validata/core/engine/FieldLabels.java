package io.validata.core.engine;

import java.util.Locale;

/** Human-readable field labels for messages. */
public final class FieldLabels {

    private FieldLabels() {}

    /**
     * Splits a camelCase wire-label into lower-case words: {@code confirmPassword} becomes
     * {@code confirm password}. Every character that equals its own upper-case form, digits and
     * punctuation included, starts a new word unless it is the first character.
     */
    public static String humanize(String label) {
        if (label == null || label.isEmpty()) {
            return "";
        }
        StringBuilder text = new StringBuilder(label.length() + 4);
        for (int i = 0; i < label.length(); i++) {
            String c = String.valueOf(label.charAt(i));
            if (c.equals(c.toUpperCase(Locale.ROOT)) && text.length() != 0) {
                text.append(' ');
            }
            text.append(c.toLowerCase(Locale.ROOT));
        }
        return text.toString();
    }

    /** Label of the {@code index}-th element (1-based) of a sequence field. */
    public static String element(String label, int index) {
        return label + " (" + index + ")";
    }
}
