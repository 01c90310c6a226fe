package io.xdiff.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One fetched row: the key in its coerced Java form plus the normalized compared column values, in
 * column order. Values are normalized text so rows from different engines compare directly; SQL NULL
 * stays {@code null}.
 */
public class Row {

    private final Object key;
    private final List<String> values;

    public Row(Object key, List<String> values) {
        this.key = key;
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public Object getKey() {
        return key;
    }

    public List<String> getValues() {
        return values;
    }

    @Override
    public String toString() {
        return "Row[" + key + " " + values + "]";
    }
}
