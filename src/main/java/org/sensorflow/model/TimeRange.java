package org.sensorflow.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Baseline selected by timestamp, both bounds inclusive.
 */
public record TimeRange(Instant start, Instant end) implements BaselineRange {

    public TimeRange {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end must not be before start");
        }
    }

    @Override
    public List<SensorSample> select(SensorFrame frame) {
        Objects.requireNonNull(frame, "frame must not be null");
        return frame.samples().stream()
                .filter(s -> !s.timestamp().isBefore(start) && !s.timestamp().isAfter(end))
                .toList();
    }

    @Override
    public String describe() {
        return "[" + start + " .. " + end + "]";
    }
}
