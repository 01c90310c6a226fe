package io.xdiff.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import com.google.common.collect.ImmutableList;

/**
 * Identifies the table on one side of a diff: where it lives, which column orders it and which columns
 * are compared. Immutable; {@link #withColumns(List)} returns a resolved copy.
 */
public class TableRef {

    private final Side side;
    private final String sourceName;
    private final TablePath path;
    private final String keyColumn;
    private final KeyType keyType;
    private final List<ColumnSpec> columns;

    public TableRef(Side side, String sourceName, TablePath path, String keyColumn, KeyType keyType,
                    List<ColumnSpec> columns) {
        this.side = Objects.requireNonNull(side, "side");
        this.sourceName = sourceName == null ? side.getName() : sourceName;
        this.path = Objects.requireNonNull(path, "path");
        this.keyColumn = Objects.requireNonNull(keyColumn, "keyColumn");
        this.keyType = Objects.requireNonNull(keyType, "keyType");
        this.columns = ImmutableList.copyOf(columns);
        for (ColumnSpec c : this.columns) {
            if (c.getName().equals(keyColumn)) {
                throw new IllegalArgumentException("Key column " + keyColumn + " cannot also be a compared column");
            }
        }
    }

    public static TableRef of(Side side, String table, String keyColumn, KeyType keyType, List<String> columns) {
        return new TableRef(side, null, new TablePath(table), keyColumn, keyType,
                columns.stream().map(ColumnSpec::unknown).collect(Collectors.toList()));
    }

    public TableRef withColumns(List<ColumnSpec> resolved) {
        return new TableRef(side, sourceName, path, keyColumn, keyType, resolved);
    }

    public Side getSide() {
        return side;
    }

    /**
     * Human readable identity of the database connection, never a full connection string.
     */
    public String getSourceName() {
        return sourceName;
    }

    public TablePath getPath() {
        return path;
    }

    public String getKeyColumn() {
        return keyColumn;
    }

    public KeyType getKeyType() {
        return keyType;
    }

    /**
     * How the key itself is normalized when it takes part in a row hash.
     */
    public ColumnSpec getKeySpec() {
        switch (keyType) {
            case INTEGER:
                return new ColumnSpec(keyColumn, ColumnType.INTEGER, 0, 0);
            case DECIMAL:
                return new ColumnSpec(keyColumn, ColumnType.DECIMAL, ColumnSpec.DEFAULT_FLOAT_SCALE, 0);
            case UUID:
                return new ColumnSpec(keyColumn, ColumnType.UUID, 0, 0);
            case TIMESTAMP:
                return new ColumnSpec(keyColumn, ColumnType.TIMESTAMP, 0, ColumnSpec.MAX_TIMESTAMP_PRECISION);
            default:
                return new ColumnSpec(keyColumn, ColumnType.STRING, 0, 0);
        }
    }

    public List<ColumnSpec> getColumns() {
        return columns;
    }

    public List<String> getColumnNames() {
        return columns.stream().map(ColumnSpec::getName).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return side.getName() + ":" + sourceName + "/" + path + " key=" + keyColumn + "(" + keyType + ") columns="
                + getColumnNames();
    }
}
