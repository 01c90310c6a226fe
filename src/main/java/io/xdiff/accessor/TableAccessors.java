package io.xdiff.accessor;

import java.util.Locale;

import io.xdiff.accessor.jdbc.JdbcTableAccessor;
import io.xdiff.accessor.mongo.MongoTableAccessor;

/**
 * Creates the accessor matching a connection URI: {@code jdbc:...} or {@code mongodb://...}.
 */
public final class TableAccessors {

    private TableAccessors() {
    }

    /**
     * @param maxQueries          largest number of concurrent queries, and connection pool size
     * @param queryTimeoutSeconds per statement timeout for JDBC, 0 for none
     */
    public static TableAccessor create(String name, String uri, String username, String password, int maxQueries,
                                       int queryTimeoutSeconds) {
        if (uri == null || uri.isEmpty()) {
            throw new IllegalArgumentException("No connection uri given for " + name);
        }
        String lower = uri.toLowerCase(Locale.ROOT);
        if (lower.startsWith("mongodb://") || lower.startsWith("mongodb+srv://")) {
            return new MongoTableAccessor(name, uri, maxQueries);
        }
        if (lower.startsWith("jdbc:")) {
            return new JdbcTableAccessor(name, uri, username, password, maxQueries, queryTimeoutSeconds);
        }
        throw new IllegalArgumentException("Unsupported connection uri for " + name + ": expected jdbc: or mongodb://");
    }
}
