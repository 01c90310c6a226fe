package io.xdiff.accessor.jdbc;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import io.xdiff.accessor.KeyBounds;
import io.xdiff.accessor.RowCursor;
import io.xdiff.accessor.TableAccessException;
import io.xdiff.accessor.TableAccessor;
import io.xdiff.model.ColumnSpec;
import io.xdiff.model.ColumnType;
import io.xdiff.model.KeyRange;
import io.xdiff.model.KeyType;
import io.xdiff.model.Row;
import io.xdiff.model.Segment;
import io.xdiff.model.TablePath;
import io.xdiff.model.TableRef;
import io.xdiff.partition.KeySpace;

/**
 * {@link TableAccessor} over a JDBC database. Counting, hashing and normalization run server side in the
 * dialect's SQL; only differing rows are ever fetched. Connections come from a HikariCP pool sized to
 * the maximum number of concurrent queries allowed against this database.
 */
public class JdbcTableAccessor implements TableAccessor {

    private static final Logger logger = LoggerFactory.getLogger(JdbcTableAccessor.class);

    public static final int DEFAULT_FETCH_SIZE = 10000;

    private static final AtomicInteger poolIdCounter = new AtomicInteger(0);

    private final String name;
    private final HikariDataSource dataSource;
    private final SqlDialect dialect;
    private final int queryTimeoutSeconds;

    private final Map<KeyType, KeySpace> keySpaces = new EnumMap<>(KeyType.class);
    private final Map<TablePath, Boolean> nativeUuidKeys = new ConcurrentHashMap<>();
    private final Map<TablePath, Boolean> zonedTimestampKeys = new ConcurrentHashMap<>();

    public JdbcTableAccessor(String name, String jdbcUrl, String username, String password, int maxConnections,
                             int queryTimeoutSeconds) {
        this.name = name;
        this.dialect = SqlDialects.forUrl(jdbcUrl);
        this.queryTimeoutSeconds = queryTimeoutSeconds;
        for (KeyType t : KeyType.values()) {
            keySpaces.put(t, KeySpace.forType(t));
        }

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setUsername(username);
        hikariConfig.setPassword(password);
        hikariConfig.setMaximumPoolSize(maxConnections);
        hikariConfig.setMinimumIdle(Math.min(2, maxConnections));
        hikariConfig.setConnectionInitSql(dialect.connectionInitSql());
        hikariConfig.setPoolName("HikariPool-" + poolIdCounter.incrementAndGet() + "-" + name);
        if (jdbcUrl.contains("postgresql")) {
            hikariConfig.addDataSourceProperty("tcpKeepAlive", "true");
        }
        this.dataSource = new HikariDataSource(hikariConfig);
        logger.info("{}: connected to {} ({}), maxPoolSize: {}", name, SqlDialects.sanitize(jdbcUrl), dialect,
                maxConnections);
    }

    public String getName() {
        return name;
    }

    public SqlDialect getDialect() {
        return dialect;
    }

    @Override
    public Optional<KeyBounds> bounds(TableRef table) {
        String key = keyExpression(table);
        String sql = "SELECT MIN(" + key + "), MAX(" + key + ") FROM " + dialect.tableName(table.getPath());
        KeySpace keySpace = keySpaces.get(table.getKeyType());
        boolean zoned = isZonedTimestampKey(table);
        return query("bounds", table, null, sql, ps -> {
        }, rs -> {
            rs.next();
            Object min = rs.getObject(1);
            Object max = rs.getObject(2);
            if (min == null) {
                return Optional.empty();
            }
            return Optional.of(new KeyBounds(keySpace.coerce(zoned ? zonedKey(min) : min),
                    keySpace.coerce(zoned ? zonedKey(max) : max)));
        });
    }

    @Override
    public long count(TableRef table, KeyRange range) {
        String sql = "SELECT COUNT(*) FROM " + dialect.tableName(table.getPath()) + " WHERE " + where(table, range);
        return query("count", table, range, sql, ps -> bindRange(ps, table, range), rs -> {
            rs.next();
            return rs.getLong(1);
        });
    }

    @Override
    public BigInteger checksum(TableRef table, KeyRange range, List<ColumnSpec> columns) {
        String sql = "SELECT " + dialect.sum(dialect.rowHash(table.getKeySpec(), columns)) + " FROM "
                + dialect.tableName(table.getPath()) + " WHERE " + where(table, range);
        return query("checksum", table, range, sql, ps -> bindRange(ps, table, range), rs -> {
            rs.next();
            return toBigInteger(rs.getBigDecimal(1));
        });
    }

    @Override
    public Segment segment(TableRef table, KeyRange range, List<ColumnSpec> columns) {
        String sql = "SELECT COUNT(*), " + dialect.sum(dialect.rowHash(table.getKeySpec(), columns)) + " FROM "
                + dialect.tableName(table.getPath()) + " WHERE " + where(table, range);
        return query("segment", table, range, sql, ps -> bindRange(ps, table, range), rs -> {
            rs.next();
            return new Segment(table.getSide(), range, rs.getLong(1), toBigInteger(rs.getBigDecimal(2)));
        });
    }

    @Override
    public RowCursor rows(TableRef table, KeyRange range, List<ColumnSpec> columns) {
        StringBuilder sql = new StringBuilder("SELECT ").append(dialect.quote(table.getKeyColumn()));
        for (ColumnSpec c : columns) {
            sql.append(", ").append(dialect.normalize(dialect.quote(c.getName()), c));
        }
        sql.append(" FROM ").append(dialect.tableName(table.getPath()))
                .append(" WHERE ").append(where(table, range))
                .append(" ORDER BY ").append(keyExpression(table));

        boolean zoned = isZonedTimestampKey(table);
        checkInterrupted();
        Connection connection = null;
        PreparedStatement ps = null;
        try {
            connection = dataSource.getConnection();
            // lets drivers stream instead of materializing the result
            connection.setAutoCommit(false);
            ps = connection.prepareStatement(sql.toString());
            ps.setFetchSize(DEFAULT_FETCH_SIZE);
            ps.setQueryTimeout(queryTimeoutSeconds);
            bindRange(ps, table, range);
            logger.trace("{}: {}", name, sql);
            ResultSet rs = ps.executeQuery();
            return new JdbcRowCursor(connection, ps, rs, keySpaces.get(table.getKeyType()), zoned, columns.size(),
                    table, range);
        } catch (SQLException e) {
            closeQuietly(ps, connection);
            throw wrap("rows", table, range, e);
        }
    }

    @Override
    public Map<String, ColumnSpec> describe(TableRef table) {
        TablePath path = table.getPath();
        return withConnection("describe", table, null, connection -> {
            Map<String, ColumnSpec> output = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
            readColumns(connection, path, (column, jdbcType, typeName, decimalDigits) ->
                    output.put(column, dialect.columnSpec(column, jdbcType, typeName, decimalDigits)));
            logger.debug("{}: {} columns {}", name, path, output.values());
            return Collections.unmodifiableMap(output);
        });
    }

    private void readColumns(Connection connection, TablePath path, ColumnVisitor visitor) throws SQLException {
        DatabaseMetaData md = connection.getMetaData();
        String catalog = null;
        String schema = path.hasSchema() ? path.getSchemaName() : connection.getSchema();
        if (dialect instanceof MySqlDialect) {
            catalog = path.hasSchema() ? path.getSchemaName() : connection.getCatalog();
            schema = null;
        }
        try (ResultSet rs = md.getColumns(catalog, schema, path.getTableName(), null)) {
            while (rs.next()) {
                int decimalDigits = rs.getInt("DECIMAL_DIGITS");
                if (rs.wasNull()) {
                    decimalDigits = -1;
                }
                visitor.visit(rs.getString("COLUMN_NAME"), rs.getInt("DATA_TYPE"), rs.getString("TYPE_NAME"),
                        decimalDigits);
            }
        }
    }

    @Override
    public void close() {
        logger.debug("{}: closing pool", name);
        dataSource.close();
    }

    private String keyExpression(TableRef table) {
        return dialect.keyExpression(dialect.quote(table.getKeyColumn()), table.getKeyType());
    }

    private String where(TableRef table, KeyRange range) {
        String key = keyExpression(table);
        if (range.isUnboundedEnd()) {
            return key + " >= ?";
        }
        return key + " >= ? AND " + key + " < ?";
    }

    private void bindRange(PreparedStatement ps, TableRef table, KeyRange range) throws SQLException {
        bindKey(ps, 1, table, range.getStart());
        if (!range.isUnboundedEnd()) {
            bindKey(ps, 2, table, range.getEnd());
        }
    }

    private void bindKey(PreparedStatement ps, int index, TableRef table, Object key) throws SQLException {
        switch (table.getKeyType()) {
            case INTEGER:
                ps.setLong(index, (Long) key);
                break;
            case DECIMAL:
                ps.setBigDecimal(index, (BigDecimal) key);
                break;
            case UUID:
                dialect.bindUuid(ps, index, (UUID) key, isNativeUuidKey(table));
                break;
            case TIMESTAMP:
                ps.setObject(index, key);
                break;
            default:
                ps.setString(index, key.toString());
        }
    }

    private boolean isNativeUuidKey(TableRef table) {
        return nativeUuidKeys.computeIfAbsent(table.getPath(), p -> {
            ColumnSpec spec = describe(table).get(table.getKeyColumn());
            return spec != null && spec.getType() == ColumnType.UUID;
        });
    }

    // resolved before a query takes its connection, the lookup needs one of its own
    private boolean isZonedTimestampKey(TableRef table) {
        if (table.getKeyType() != KeyType.TIMESTAMP) {
            return false;
        }
        return zonedTimestampKeys.computeIfAbsent(table.getPath(), p -> withConnection("describe", table, null,
                connection -> {
                    boolean[] zoned = new boolean[1];
                    readColumns(connection, p, (column, jdbcType, typeName, decimalDigits) -> {
                        if (column.equalsIgnoreCase(table.getKeyColumn())) {
                            zoned[0] = dialect.isZonedTimestamp(jdbcType, typeName);
                        }
                    });
                    return zoned[0];
                }));
    }

    /**
     * A zoned timestamp key read through {@link Timestamp} carries the right instant but prints
     * in the JVM zone; hand the instant on so the key space places it at UTC.
     */
    static Object zonedKey(Object raw) {
        return raw instanceof Timestamp ? ((Timestamp) raw).toInstant() : raw;
    }

    private static BigInteger toBigInteger(BigDecimal sum) {
        return sum == null ? BigInteger.ZERO : sum.toBigIntegerExact();
    }

    private <T> T query(String operation, TableRef table, KeyRange range, String sql, Binder binder,
                        ResultReader<T> reader) {
        return withConnection(operation, table, range, connection -> {
            try (PreparedStatement ps = connection.prepareStatement(sql)) {
                ps.setQueryTimeout(queryTimeoutSeconds);
                binder.bind(ps);
                logger.trace("{}: {}", name, sql);
                try (ResultSet rs = ps.executeQuery()) {
                    return reader.read(rs);
                }
            }
        });
    }

    private <T> T withConnection(String operation, TableRef table, KeyRange range, ConnectionCallback<T> callback) {
        checkInterrupted();
        try (Connection connection = dataSource.getConnection()) {
            return callback.doInConnection(connection);
        } catch (SQLException e) {
            throw wrap(operation, table, range, e);
        }
    }

    private TableAccessException wrap(String operation, TableRef table, KeyRange range, SQLException e) {
        String where = range == null ? "" : " range " + range;
        return new TableAccessException(name + ": " + operation + " on " + table.getPath() + where + " failed: "
                + e.getMessage(), e, dialect.isTransient(e));
    }

    private static void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new TableAccessException("Interrupted", false);
        }
    }

    private static void closeQuietly(AutoCloseable... resources) {
        for (AutoCloseable c : resources) {
            if (c == null) {
                continue;
            }
            try {
                c.close();
            } catch (Exception e) {
                logger.warn("Error closing {}", c, e);
            }
        }
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    @FunctionalInterface
    private interface ResultReader<T> {
        T read(ResultSet rs) throws SQLException;
    }

    @FunctionalInterface
    private interface ColumnVisitor {
        void visit(String column, int jdbcType, String typeName, int decimalDigits);
    }

    @FunctionalInterface
    private interface ConnectionCallback<T> {
        T doInConnection(Connection connection) throws SQLException;
    }

    private class JdbcRowCursor implements RowCursor {

        private final Connection connection;
        private final PreparedStatement statement;
        private final ResultSet resultSet;
        private final KeySpace keySpace;
        private final boolean zoned;
        private final int columnCount;
        private final TableRef table;
        private final KeyRange range;
        private Row next;
        private boolean done;

        JdbcRowCursor(Connection connection, PreparedStatement statement, ResultSet resultSet, KeySpace keySpace,
                      boolean zoned, int columnCount, TableRef table, KeyRange range) {
            this.connection = connection;
            this.statement = statement;
            this.resultSet = resultSet;
            this.keySpace = keySpace;
            this.zoned = zoned;
            this.columnCount = columnCount;
            this.table = table;
            this.range = range;
        }

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            if (done) {
                return false;
            }
            try {
                if (!resultSet.next()) {
                    done = true;
                    return false;
                }
                Object raw = resultSet.getObject(1);
                Object key = keySpace.coerce(zoned ? zonedKey(raw) : raw);
                List<String> values = new ArrayList<>(columnCount);
                for (int i = 0; i < columnCount; i++) {
                    values.add(resultSet.getString(i + 2));
                }
                next = new Row(key, values);
                return true;
            } catch (SQLException e) {
                throw wrap("rows", table, range, e);
            }
        }

        @Override
        public Row next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Row r = next;
            next = null;
            return r;
        }

        @Override
        public void close() {
            closeQuietly(resultSet, statement, connection);
        }
    }
}
