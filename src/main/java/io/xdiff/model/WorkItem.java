package io.xdiff.model;

/**
 * A key range waiting to be compared across both sides, at a given bisection depth.
 */
public class WorkItem implements Comparable<WorkItem> {

    private final KeyRange range;
    private final int depth;

    public WorkItem(KeyRange range, int depth) {
        this.range = range;
        this.depth = depth;
    }

    public WorkItem child(KeyRange childRange) {
        return new WorkItem(childRange, depth + 1);
    }

    public KeyRange getRange() {
        return range;
    }

    public int getDepth() {
        return depth;
    }

    // shallower items first
    @Override
    public int compareTo(WorkItem o) {
        return Integer.compare(depth, o.depth);
    }

    @Override
    public String toString() {
        return "WorkItem[depth=" + depth + ", range=" + range + "]";
    }
}
