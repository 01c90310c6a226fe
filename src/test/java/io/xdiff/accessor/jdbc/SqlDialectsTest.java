package io.xdiff.accessor.jdbc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.sql.Types;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

import io.xdiff.model.ColumnSpec;
import io.xdiff.model.ColumnType;
import io.xdiff.model.KeyType;
import io.xdiff.model.TablePath;

public class SqlDialectsTest {

    @Test
    public void testForUrl() {
        assertTrue(SqlDialects.forUrl("jdbc:postgresql://db:5432/app") instanceof PostgresDialect);
        assertTrue(SqlDialects.forUrl("jdbc:mysql://db/app") instanceof MySqlDialect);
        assertTrue(SqlDialects.forUrl("jdbc:mariadb://db/app") instanceof MySqlDialect);
        assertTrue(SqlDialects.forUrl("jdbc:h2:mem:test") instanceof H2Dialect);
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> SqlDialects.forUrl("jdbc:oracle:thin:@host:1521/x?password=secret"));
        assertFalse(e.getMessage().contains("secret"));
    }

    @Test
    public void testSanitize() {
        assertEquals("jdbc:postgresql://db:5432/app",
                SqlDialects.sanitize("jdbc:postgresql://user:secret@db:5432/app?sslmode=require"));
        assertEquals("jdbc:h2:mem:x", SqlDialects.sanitize("jdbc:h2:mem:x;DB_CLOSE_DELAY=-1"));
        assertEquals("jdbc:mysql://db/app", SqlDialects.sanitize("jdbc:mysql://db/app"));
    }

    @Test
    public void testPostgresHash() {
        SqlDialect pg = new PostgresDialect();
        assertEquals("(('x' || SUBSTRING(MD5(t), 18))::bit(60)::bigint - 576460752303423487)", pg.md5AsLong("t"));
        assertEquals("\"public\".\"orders\"", pg.tableName(new TablePath("public.orders")));
        assertEquals("RPAD(LEFT(TO_CHAR(\"ts\", 'YYYY-MM-DD HH24:MI:SS.US'), 23), 26, '0')",
                pg.normalize("\"ts\"", new ColumnSpec("ts", ColumnType.TIMESTAMP, 0, 3)));
        assertEquals("SET TIME ZONE 'UTC'", pg.connectionInitSql());
    }

    @Test
    public void testTextKeysCompareInBinaryOrder() {
        assertEquals("\"name\" COLLATE \"C\"", new PostgresDialect().keyExpression("\"name\"", KeyType.STRING));
        assertEquals("\"_id\" COLLATE \"C\"", new PostgresDialect().keyExpression("\"_id\"", KeyType.OBJECTID));
        assertEquals("\"id\"", new PostgresDialect().keyExpression("\"id\"", KeyType.INTEGER));
        assertEquals("CONVERT(`name` USING utf8mb4) COLLATE utf8mb4_bin",
                new MySqlDialect().keyExpression("`name`", KeyType.STRING));
        assertEquals("`ts`", new MySqlDialect().keyExpression("`ts`", KeyType.TIMESTAMP));
        assertEquals("\"name\"", new H2Dialect().keyExpression("\"name\"", KeyType.STRING));
    }

    @Test
    public void testZonedTimestampColumns() {
        SqlDialect pg = new PostgresDialect();
        assertTrue(pg.isZonedTimestamp(Types.TIMESTAMP, "timestamptz"));
        assertTrue(pg.isZonedTimestamp(Types.TIMESTAMP_WITH_TIMEZONE, "TIMESTAMP WITH TIME ZONE"));
        assertFalse(pg.isZonedTimestamp(Types.TIMESTAMP, "timestamp"));
        assertFalse(new MySqlDialect().isZonedTimestamp(Types.TIMESTAMP, "DATETIME"));
    }

    @Test
    public void testMySqlQuotingAndHash() {
        SqlDialect mysql = new MySqlDialect();
        assertEquals("`my``table`", mysql.quote("my`table"));
        assertEquals("(CAST(CONV(SUBSTRING(MD5(t), 18), 16, 10) AS SIGNED) - 576460752303423487)",
                mysql.md5AsLong("t"));
        assertEquals("CASE WHEN b IS NULL THEN NULL WHEN b <> 0 THEN '1' ELSE '0' END",
                mysql.normalize("b", new ColumnSpec("b", ColumnType.BOOLEAN, 0, 0)));
    }

    @Test
    public void testRowHash() {
        SqlDialect h2 = new H2Dialect();
        String sql = h2.rowHash(new ColumnSpec("id", ColumnType.INTEGER, 0, 0),
                Arrays.asList(new ColumnSpec("name", ColumnType.STRING, 0, 0),
                        new ColumnSpec("price", ColumnType.DECIMAL, 2, 0)));
        assertEquals("XDIFF_MD5_INT(CONCAT(COALESCE(CAST(\"id\" AS VARCHAR), '<null>'), '|', "
                + "COALESCE(CAST(\"name\" AS VARCHAR), '<null>'), '|', "
                + "COALESCE(CAST(CAST(\"price\" AS DECIMAL(38, 2)) AS VARCHAR), '<null>')))", sql);
        assertEquals("SUM(CAST(x AS DECIMAL(38, 0)))", h2.sum("x"));
    }

    @Test
    public void testColumnSpec() {
        SqlDialect dialect = new PostgresDialect();
        assertEquals(new ColumnSpec("n", ColumnType.DECIMAL, 2, 0), dialect.columnSpec("n", Types.NUMERIC, "numeric", 2));
        assertEquals(ColumnType.UUID, dialect.columnSpec("u", Types.OTHER, "uuid", 0).getType());
        assertEquals(6, dialect.columnSpec("t", Types.TIMESTAMP, "timestamp", -1).getPrecision());
        assertEquals(ColumnType.INTEGER, dialect.columnSpec("i", Types.SMALLINT, "int2", 0).getType());
        assertEquals(ColumnType.UNKNOWN, dialect.columnSpec("j", Types.OTHER, "jsonb", 0).getType());
        assertEquals("\"x\"", new H2Dialect().quote("x"));
    }

    @Test
    public void testTransientErrors() {
        SqlDialect dialect = new PostgresDialect();
        assertTrue(dialect.isTransient(new SQLTransientConnectionException("pool exhausted")));
        assertTrue(dialect.isTransient(new SQLException("connection lost", "08006")));
        assertTrue(dialect.isTransient(new SQLException("serialization failure", "40001")));
        assertFalse(dialect.isTransient(new SQLException("relation does not exist", "42P01")));
        assertFalse(dialect.isTransient(new SQLException("no state")));
    }
}
