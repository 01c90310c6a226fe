package io.xdiff.accessor.jdbc;

import io.xdiff.accessor.Checksums;

/**
 * H2 has no hex-to-integer conversion; the row hash is a Java alias onto {@link Checksums}.
 */
public class H2Dialect extends SqlDialect {

    public static final String MD5_FUNCTION = "XDIFF_MD5_INT";

    @Override
    public String getName() {
        return "h2";
    }

    @Override
    public String toText(String expr) {
        return "CAST(" + expr + " AS VARCHAR)";
    }

    @Override
    public String md5AsLong(String textExpr) {
        return MD5_FUNCTION + "(" + textExpr + ")";
    }

    @Override
    protected String formatTimestamp(String expr) {
        return "FORMATDATETIME(" + expr + ", 'yyyy-MM-dd HH:mm:ss.SSSSSS')";
    }

    @Override
    public String connectionInitSql() {
        return "CREATE ALIAS IF NOT EXISTS " + MD5_FUNCTION + " FOR '" + Checksums.class.getName() + ".md5AsLong'";
    }
}
