package io.xdiff.model;

import java.util.Locale;

/**
 * Semantic type of the key column. Determines how key ranges are split and how raw key values coming
 * back from a backend are coerced.
 */
public enum KeyType {
    INTEGER,
    DECIMAL,
    UUID,
    TIMESTAMP,
    STRING,
    OBJECTID;

    public static KeyType fromString(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Key type is required");
        }
        String n = name.trim().toUpperCase(Locale.ROOT);
        switch (n) {
            case "INT":
            case "LONG":
            case "BIGINT":
                return INTEGER;
            case "NUMERIC":
                return DECIMAL;
            case "DATETIME":
                return TIMESTAMP;
            case "TEXT":
            case "VARCHAR":
                return STRING;
            case "OID":
                return OBJECTID;
            default:
                return KeyType.valueOf(n);
        }
    }
}
