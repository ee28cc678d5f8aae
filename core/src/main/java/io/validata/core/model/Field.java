package io.validata.core.model;

import java.util.Objects;

/**
 * One named member of a {@link Record}.
 *
 * @param name  source name (e.g. the Java field name), for diagnostics
 * @param label wire-label used as the report key and in messages; may be {@code null}
 * @param value runtime value
 * @param rules rule-chain string; may be {@code null}
 */
public record Field(String name, String label, Value value, String rules) {

    public Field {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    /** A field is validated only when it carries both a wire-label and a rule chain. */
    public boolean isEligible() {
        return label != null && !label.isEmpty() && rules != null;
    }
}
