package io.xdiff.accessor.jdbc;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

import io.xdiff.accessor.Checksums;
import io.xdiff.accessor.ValueNormalizer;
import io.xdiff.model.ColumnSpec;
import io.xdiff.model.ColumnType;
import io.xdiff.model.KeyType;
import io.xdiff.model.TablePath;

/**
 * Renders the SQL one engine needs for range-scoped counting, hashing and fetching. Every
 * {@code normalize*} method must produce the text {@link ValueNormalizer} produces for the same value,
 * and {@link #md5AsLong(String)} must match {@link Checksums#md5AsLong(String)}.
 */
public abstract class SqlDialect {

    public abstract String getName();

    /**
     * Casts an expression to the engine's character type.
     */
    public abstract String toText(String expr);

    /**
     * Low 60 bits of the MD5 of a text expression, minus {@link Checksums#CHECKSUM_OFFSET}, as an integer.
     */
    public abstract String md5AsLong(String textExpr);

    /**
     * Formats a timestamp as {@code yyyy-MM-dd HH:mm:ss.ffffff} with all six fraction digits.
     */
    protected abstract String formatTimestamp(String expr);

    /**
     * Statement run on every new pooled connection, or {@code null}.
     */
    public String connectionInitSql() {
        return null;
    }

    public String quote(String identifier) {
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }

    /**
     * The key column as it appears in bounds, range predicates and ordering. Text keys must compare in
     * binary order there, the order {@link io.xdiff.partition.StringKeySpace} splits and merges in,
     * whatever collation the column was declared with.
     */
    public String keyExpression(String quotedKey, KeyType keyType) {
        return quotedKey;
    }

    protected static boolean isTextKey(KeyType keyType) {
        return keyType == KeyType.STRING || keyType == KeyType.OBJECTID;
    }

    public String tableName(TablePath path) {
        return path.hasSchema() ? quote(path.getSchemaName()) + "." + quote(path.getTableName())
                : quote(path.getTableName());
    }

    public String normalize(String expr, ColumnSpec column) {
        switch (column.getType()) {
            case INTEGER:
                return normalizeInteger(expr);
            case DECIMAL:
            case FLOAT:
                return normalizeNumber(expr, column.getScale());
            case TIMESTAMP:
                return normalizeTimestamp(expr, column.getPrecision());
            case BOOLEAN:
                return normalizeBoolean(expr);
            case UUID:
                return "LOWER(TRIM(" + toText(expr) + "))";
            default:
                return toText(expr);
        }
    }

    protected String normalizeInteger(String expr) {
        return toText(expr);
    }

    protected String normalizeNumber(String expr, int scale) {
        return toText("CAST(" + expr + " AS DECIMAL(38, " + scale + "))");
    }

    protected String normalizeTimestamp(String expr, int precision) {
        return "RPAD(LEFT(" + formatTimestamp(expr) + ", " + (ValueNormalizer.TIMESTAMP_PRECISION_POS + precision)
                + "), " + ValueNormalizer.TIMESTAMP_TEXT_LENGTH + ", '0')";
    }

    protected String normalizeBoolean(String expr) {
        return "CASE WHEN " + expr + " IS NULL THEN NULL WHEN " + expr + " THEN '1' ELSE '0' END";
    }

    /**
     * Hash expression of one row: key and columns, normalized, NULLs rendered as text, joined by the
     * separator.
     */
    public String rowHash(ColumnSpec key, List<ColumnSpec> columns) {
        List<String> parts = new ArrayList<>();
        parts.add(nullSafe(normalize(quote(key.getName()), key)));
        for (ColumnSpec c : columns) {
            parts.add("'" + Checksums.SEPARATOR + "'");
            parts.add(nullSafe(normalize(quote(c.getName()), c)));
        }
        return md5AsLong(concat(parts));
    }

    public String sum(String expr) {
        return "SUM(CAST(" + expr + " AS DECIMAL(38, 0)))";
    }

    protected String concat(List<String> parts) {
        return "CONCAT(" + String.join(", ", parts) + ")";
    }

    protected String nullSafe(String expr) {
        return "COALESCE(" + expr + ", '" + Checksums.NULL_TEXT + "')";
    }

    /**
     * Maps {@code DatabaseMetaData.getColumns} information to a {@link ColumnSpec}.
     */
    public ColumnSpec columnSpec(String name, int jdbcType, String typeName, int decimalDigits) {
        String tn = typeName == null ? "" : typeName.toLowerCase(Locale.ROOT);
        if (tn.equals("uuid") || tn.equals("uniqueidentifier")) {
            return new ColumnSpec(name, ColumnType.UUID, 0, 0);
        }
        switch (jdbcType) {
            case Types.TINYINT:
            case Types.SMALLINT:
            case Types.INTEGER:
            case Types.BIGINT:
                return new ColumnSpec(name, ColumnType.INTEGER, 0, 0);
            case Types.NUMERIC:
            case Types.DECIMAL:
                return new ColumnSpec(name, ColumnType.DECIMAL, decimalDigits, 0);
            case Types.REAL:
            case Types.FLOAT:
            case Types.DOUBLE:
                return new ColumnSpec(name, ColumnType.FLOAT, ColumnSpec.DEFAULT_FLOAT_SCALE, 0);
            case Types.DATE:
                return new ColumnSpec(name, ColumnType.TIMESTAMP, 0, 0);
            case Types.TIMESTAMP:
            case Types.TIMESTAMP_WITH_TIMEZONE:
                return new ColumnSpec(name, ColumnType.TIMESTAMP, 0, timestampPrecision(decimalDigits));
            case Types.BOOLEAN:
            case Types.BIT:
                return new ColumnSpec(name, ColumnType.BOOLEAN, 0, 0);
            case Types.CHAR:
            case Types.VARCHAR:
            case Types.LONGVARCHAR:
            case Types.NCHAR:
            case Types.NVARCHAR:
            case Types.LONGNVARCHAR:
            case Types.CLOB:
                return new ColumnSpec(name, ColumnType.STRING, 0, 0);
            default:
                return ColumnSpec.unknown(name);
        }
    }

    /**
     * Whether a column holds instants, so that a driver's {@link java.sql.Timestamp} for it must be read
     * through its instant rather than its JVM-zone wall clock.
     */
    public boolean isZonedTimestamp(int jdbcType, String typeName) {
        if (jdbcType == Types.TIMESTAMP_WITH_TIMEZONE) {
            return true;
        }
        String tn = typeName == null ? "" : typeName.toLowerCase(Locale.ROOT);
        return tn.equals("timestamptz") || tn.equals("timestamp with time zone");
    }

    protected int timestampPrecision(int decimalDigits) {
        return decimalDigits < 0 ? ColumnSpec.MAX_TIMESTAMP_PRECISION : decimalDigits;
    }

    /**
     * Binds a uuid key. Native uuid columns take the object, text columns the lower-case string.
     */
    public void bindUuid(PreparedStatement ps, int index, UUID key, boolean nativeUuidColumn) throws SQLException {
        if (nativeUuidColumn) {
            ps.setObject(index, key);
        } else {
            ps.setString(index, key.toString());
        }
    }

    public boolean isTransient(SQLException e) {
        if (e instanceof SQLTransientException || e instanceof SQLRecoverableException) {
            return true;
        }
        String state = e.getSQLState();
        // connection exceptions and serialization failures
        return state != null && (state.startsWith("08") || state.equals("40001"));
    }

    @Override
    public String toString() {
        return getName();
    }
}
