package io.validata.core.engine.jdbc;

/** Existence-query shape per database. Identifiers are validated before they are spliced in. */
public enum SqlDialect {
    POSTGRES {
        @Override
        String existsQuery(String table, String column) {
            return "SELECT 1 FROM " + table + " WHERE " + column + " = ?";
        }
    },
    MYSQL {
        @Override
        String existsQuery(String table, String column) {
            return "SELECT " + column + " FROM " + table + " WHERE " + column + " = ?";
        }
    };

    abstract String existsQuery(String table, String column);
}
