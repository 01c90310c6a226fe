package io.xdiff.model;

/**
 * Normalized column type. Both sides render a column with the same {@link ColumnType} into the same
 * text before hashing, whatever their native types are.
 */
public enum ColumnType {
    INTEGER,
    DECIMAL,
    FLOAT,
    TIMESTAMP,
    BOOLEAN,
    UUID,
    STRING,
    UNKNOWN;

    public boolean isNumeric() {
        return this == INTEGER || this == DECIMAL || this == FLOAT;
    }

    /**
     * Whether values of the two types can be normalized into a common representation.
     * {@link #UNKNOWN} is compatible with anything: the backend could not tell.
     */
    public boolean isCompatibleWith(ColumnType other) {
        if (this == UNKNOWN || other == UNKNOWN || this == other) {
            return true;
        }
        if (isNumeric() && other.isNumeric()) {
            return true;
        }
        // uuids are frequently stored as text on one side
        return (this == UUID && other == STRING) || (this == STRING && other == UUID);
    }

    /**
     * The type both sides are normalized to.
     */
    public ColumnType commonWith(ColumnType other) {
        if (this == other || other == UNKNOWN) {
            return this;
        }
        if (this == UNKNOWN) {
            return other;
        }
        if (isNumeric() && other.isNumeric()) {
            return this == INTEGER && other == INTEGER ? INTEGER : DECIMAL;
        }
        if (this == UUID || other == UUID) {
            return UUID;
        }
        throw new IllegalArgumentException("Incompatible column types " + this + " and " + other);
    }
}
