package io.xdiff.model;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Qualified name of a table (or collection): an optional schema/database part and the table name.
 */
public class TablePath implements Comparable<TablePath> {

    private final String schemaName;
    private final String tableName;

    private final static Pattern pathPattern = Pattern.compile("^(.*?)\\.(.*)$");

    public TablePath(String path) {
        Matcher m = pathPattern.matcher(path);
        if (m.find()) {
            schemaName = m.group(1);
            tableName = m.group(2);
        } else {
            schemaName = null;
            tableName = path;
        }
    }

    public TablePath(String schemaName, String tableName) {
        this.schemaName = schemaName;
        this.tableName = tableName;
    }

    public boolean hasSchema() {
        return schemaName != null && !schemaName.isEmpty();
    }

    public String getSchemaName() {
        return schemaName;
    }

    public String getTableName() {
        return tableName;
    }

    public String getPath() {
        return hasSchema() ? schemaName + "." + tableName : tableName;
    }

    public String toString() {
        return getPath();
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + ((tableName == null) ? 0 : tableName.hashCode());
        result = prime * result + ((schemaName == null) ? 0 : schemaName.hashCode());
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        TablePath other = (TablePath) obj;
        if (tableName == null) {
            if (other.tableName != null)
                return false;
        } else if (!tableName.equals(other.tableName))
            return false;
        if (schemaName == null) {
            if (other.schemaName != null)
                return false;
        } else if (!schemaName.equals(other.schemaName))
            return false;
        return true;
    }

    @Override
    public int compareTo(TablePath o) {
        return this.getPath().compareTo(o.getPath());
    }

}
