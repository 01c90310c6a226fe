package io.xdiff.diff;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * The two tables cannot be compared: a column is missing or the column types are incompatible.
 */
public class SchemaMismatchException extends DiffRunException {

    private static final long serialVersionUID = 1L;

    private final List<String> problems;

    public SchemaMismatchException(List<String> problems) {
        super("Schema mismatch: " + String.join("; ", problems), "init");
        this.problems = ImmutableList.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
