package io.xdiff.accessor.jdbc;

import io.xdiff.accessor.Checksums;
import io.xdiff.model.KeyType;

public class MySqlDialect extends SqlDialect {

    @Override
    public String getName() {
        return "mysql";
    }

    @Override
    public String quote(String identifier) {
        return '`' + identifier.replace("`", "``") + '`';
    }

    @Override
    public String keyExpression(String quotedKey, KeyType keyType) {
        return isTextKey(keyType) ? "CONVERT(" + quotedKey + " USING utf8mb4) COLLATE utf8mb4_bin" : quotedKey;
    }

    @Override
    public String toText(String expr) {
        return "CAST(" + expr + " AS CHAR)";
    }

    @Override
    public String md5AsLong(String textExpr) {
        return "(CAST(CONV(SUBSTRING(MD5(" + textExpr + "), " + Checksums.checksumHexStart()
                + "), 16, 10) AS SIGNED) - " + Checksums.CHECKSUM_OFFSET + ")";
    }

    @Override
    protected String formatTimestamp(String expr) {
        return "DATE_FORMAT(" + expr + ", '%Y-%m-%d %H:%i:%s.%f')";
    }

    // booleans are TINYINT(1)
    @Override
    protected String normalizeBoolean(String expr) {
        return "CASE WHEN " + expr + " IS NULL THEN NULL WHEN " + expr + " <> 0 THEN '1' ELSE '0' END";
    }

    @Override
    public String connectionInitSql() {
        return "SET time_zone = '+00:00'";
    }
}
