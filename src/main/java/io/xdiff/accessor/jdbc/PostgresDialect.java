package io.xdiff.accessor.jdbc;

import io.xdiff.accessor.Checksums;
import io.xdiff.model.KeyType;

public class PostgresDialect extends SqlDialect {

    @Override
    public String getName() {
        return "postgresql";
    }

    @Override
    public String keyExpression(String quotedKey, KeyType keyType) {
        return isTextKey(keyType) ? quotedKey + " COLLATE \"C\"" : quotedKey;
    }

    @Override
    public String toText(String expr) {
        return "CAST(" + expr + " AS VARCHAR)";
    }

    @Override
    public String md5AsLong(String textExpr) {
        return "(('x' || SUBSTRING(MD5(" + textExpr + "), " + Checksums.checksumHexStart() + "))::bit("
                + Checksums.CHECKSUM_HEXDIGITS * 4 + ")::bigint - " + Checksums.CHECKSUM_OFFSET + ")";
    }

    @Override
    protected String formatTimestamp(String expr) {
        return "TO_CHAR(" + expr + ", 'YYYY-MM-DD HH24:MI:SS.US')";
    }

    @Override
    public String connectionInitSql() {
        return "SET TIME ZONE 'UTC'";
    }
}
