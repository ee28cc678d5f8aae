package io.validata.core.model;

import java.util.Objects;

/**
 * Table and column named by {@code unique:table.column}.
 *
 * @param table  table name as written in the rule
 * @param column column (or field) name as written in the rule
 */
public record UniqueTarget(String table, String column) {

    public UniqueTarget {
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(column, "column must not be null");
    }

    @Override
    public String toString() {
        return table + "." + column;
    }
}
