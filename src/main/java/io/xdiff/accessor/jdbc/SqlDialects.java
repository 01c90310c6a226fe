package io.xdiff.accessor.jdbc;

import java.util.Locale;

/**
 * Picks the dialect for a JDBC URL.
 */
public final class SqlDialects {

    private SqlDialects() {
    }

    public static SqlDialect forUrl(String jdbcUrl) {
        if (jdbcUrl == null) {
            throw new IllegalArgumentException("JDBC URL is required");
        }
        String url = jdbcUrl.toLowerCase(Locale.ROOT);
        if (url.startsWith("jdbc:postgresql:")) {
            return new PostgresDialect();
        }
        if (url.startsWith("jdbc:mysql:") || url.startsWith("jdbc:mariadb:")) {
            return new MySqlDialect();
        }
        if (url.startsWith("jdbc:h2:")) {
            return new H2Dialect();
        }
        throw new IllegalArgumentException("Unsupported database: " + sanitize(jdbcUrl));
    }

    /**
     * Strips credentials and parameters from a JDBC URL so it can be logged.
     */
    public static String sanitize(String jdbcUrl) {
        String s = jdbcUrl;
        int q = s.indexOf('?');
        if (q >= 0) {
            s = s.substring(0, q);
        }
        int semi = s.indexOf(';');
        if (semi >= 0) {
            s = s.substring(0, semi);
        }
        int at = s.indexOf('@');
        int scheme = s.indexOf("//");
        if (at > 0 && scheme >= 0 && at > scheme) {
            s = s.substring(0, scheme + 2) + s.substring(at + 1);
        }
        return s;
    }
}
