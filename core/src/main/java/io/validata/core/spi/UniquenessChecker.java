package io.validata.core.spi;

import io.validata.core.model.UniqueTarget;

/**
 * Existence query behind the {@code unique:table.column} rule.
 *
 * <p>
 * Implementations MUST be thread-safe. A store that cannot answer (connection refused, missing
 * table) throws {@link io.validata.core.error.UniquenessCheckException}; the validator re-throws
 * it from the validation call instead of reporting the field as valid or invalid.
 */
@FunctionalInterface
public interface UniquenessChecker {

    /**
     * @param target table and column to query
     * @param value  the field's text rendering
     * @return {@code true} if the value already exists
     */
    boolean exists(UniqueTarget target, String value);
}
