package io.validata.core.engine.predicate;

import java.util.List;

/** Enumeration membership and cross-field equality. */
public final class MembershipPredicates {

    private MembershipPredicates() {}

    /**
     * Exact, case-sensitive membership of {@code text} in a comma-separated list.
     *
     * @param options the raw rule argument, e.g. {@code "admin,user"}
     */
    public static boolean isNotEnum(String text, String options) {
        return !List.of(options.split(",", -1)).contains(text);
    }

    /** Compares two renderings after trimming surrounding whitespace. */
    public static boolean isNotSame(String text, String other) {
        return !text.strip().equals(other.strip());
    }
}
