package io.xdiff.partition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.xdiff.model.KeyRange;

/**
 * Splits a key range into at most {@code factor} contiguous, non-overlapping sub-ranges that cover it
 * exactly. A result holding only the input range means the range cannot be split any further.
 */
public class RangePartitioner {

    private static final Logger logger = LoggerFactory.getLogger(RangePartitioner.class);

    private final KeySpace keySpace;

    public RangePartitioner(KeySpace keySpace) {
        this.keySpace = keySpace;
    }

    public List<KeyRange> split(KeyRange range, int factor) {
        if (factor < 2) {
            throw new IllegalArgumentException("Branching factor must be at least 2, got " + factor);
        }
        List<KeyRange> output = new ArrayList<>();
        Object start = range.getStart();
        Object end = range.getEnd();

        if (range.isUnboundedEnd()) {
            if (keySpace.compare(start, end) == 0) {
                return Collections.singletonList(range);
            }
            // the last child keeps the open tail, starting at the observed maximum
            List<Object> bounds = allBounds(start, keySpace.splitPoints(start, end, factor - 1), end);
            for (int i = 0; i < bounds.size() - 1; i++) {
                output.add(KeyRange.bounded(bounds.get(i), bounds.get(i + 1), keySpace));
            }
            output.add(KeyRange.unbounded(end, end, keySpace));
        } else {
            List<Object> bounds = allBounds(start, keySpace.splitPoints(start, end, factor), end);
            for (int i = 0; i < bounds.size() - 1; i++) {
                output.add(KeyRange.bounded(bounds.get(i), bounds.get(i + 1), keySpace));
            }
        }
        logger.trace("split {} into {} ranges", range, output.size());
        return output;
    }

    public boolean isMaximallyBisected(List<KeyRange> children) {
        return children.size() < 2;
    }

    public KeySpace getKeySpace() {
        return keySpace;
    }

    private List<Object> allBounds(Object min, List<Object> mid, Object max) {
        List<Object> output = new ArrayList<>();
        output.add(min);
        output.addAll(mid);
        output.add(max);
        return output;
    }
}
