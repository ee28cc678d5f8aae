package io.validata.core.engine.jdbc;

import io.validata.core.error.RuleEvaluationException;
import io.validata.core.error.UniquenessCheckException;
import io.validata.core.model.UniqueTarget;
import io.validata.core.spi.UniquenessChecker;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;
import java.util.regex.Pattern;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link UniquenessChecker} querying a relational table through a caller-supplied
 * {@link DataSource}.
 *
 * <p>
 * The column of {@code unique:table.column} is converted from camelCase to snake_case
 * ({@code emailAddress} becomes {@code email_address}). Table and column must be plain SQL
 * identifiers; anything else is rejected before a query is built. The value is always bound as a
 * statement parameter.
 *
 * <p>
 * A connection is borrowed per query and returned immediately; pooling is the data source's
 * concern. Thread-safe.
 */
public final class JdbcUniquenessChecker implements UniquenessChecker {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcUniquenessChecker.class);
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final DataSource dataSource;
    private final SqlDialect dialect;

    public JdbcUniquenessChecker(DataSource dataSource, SqlDialect dialect) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
    }

    /**
     * @throws RuleEvaluationException   if the table or column is not a plain identifier
     * @throws UniquenessCheckException if the query fails
     */
    @Override
    public boolean exists(UniqueTarget target, String value) {
        String table = requireIdentifier(target.table(), target);
        String column = requireIdentifier(snakeCase(target.column()), target);
        String sql = dialect.existsQuery(table, column);

        try (Connection connection = dataSource.getConnection();
                PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, value);
            try (ResultSet rs = statement.executeQuery()) {
                boolean exists = rs.next();
                LOG.debug("unique.checked table={} column={} exists={}", table, column, exists);
                return exists;
            }
        } catch (SQLException e) {
            throw new UniquenessCheckException(
                    "uniqueness query on " + table + "." + column + " failed: " + e.getMessage(), e, null);
        }
    }

    /**
     * Converts camelCase to snake_case. An upper-case letter gets a leading underscore when it
     * is not first and borders a lower-case letter on either side, so {@code userID} becomes
     * {@code user_id} and {@code HTTPServer} becomes {@code http_server}.
     */
    static String snakeCase(String camel) {
        StringBuilder snake = new StringBuilder(camel.length() + 4);
        int length = camel.length();
        for (int i = 0; i < length; i++) {
            char c = camel.charAt(i);
            if (c < 'A' || c > 'Z') {
                snake.append(c);
                continue;
            }
            boolean afterLower = i > 0 && isLower(camel.charAt(i - 1));
            boolean beforeLower = i < length - 1 && isLower(camel.charAt(i + 1));
            if (i != 0 && (afterLower || beforeLower) && camel.charAt(i - 1) != '_') {
                snake.append('_');
            }
            snake.append((char) (c + ('a' - 'A')));
        }
        return snake.toString();
    }

    private static boolean isLower(char c) {
        return c >= 'a' && c <= 'z';
    }

    private static String requireIdentifier(String identifier, UniqueTarget target) {
        if (!IDENTIFIER.matcher(identifier).matches()) {
            throw new RuleEvaluationException(
                    "invalid identifier '" + identifier + "' in unique:" + target.table() + "." + target.column(),
                    "unique:" + target.table() + "." + target.column());
        }
        return identifier;
    }
}
