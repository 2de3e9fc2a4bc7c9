package org.sensorflow.model;

import java.util.List;
import java.util.Objects;

/**
 * Baseline selected by row index: [fromInclusive, toExclusive).
 * Indices past the end of the frame are clipped.
 */
public record RowRange(int fromInclusive, int toExclusive) implements BaselineRange {

    public RowRange {
        if (fromInclusive < 0) {
            throw new IllegalArgumentException("fromInclusive must be >= 0");
        }
        if (toExclusive < fromInclusive) {
            throw new IllegalArgumentException("toExclusive must be >= fromInclusive");
        }
    }

    /** The first {@code count} rows. */
    public static RowRange firstRows(int count) {
        return new RowRange(0, count);
    }

    @Override
    public List<SensorSample> select(SensorFrame frame) {
        Objects.requireNonNull(frame, "frame must not be null");
        int from = Math.min(fromInclusive, frame.size());
        int to = Math.min(toExclusive, frame.size());
        return frame.samples().subList(from, to);
    }

    @Override
    public String describe() {
        return "rows [" + fromInclusive + ", " + toExclusive + ")";
    }
}
