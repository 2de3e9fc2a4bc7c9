package org.sensorflow.model;

import org.sensorflow.error.DimensionMismatchException;
import org.sensorflow.error.InvalidInputException;

import java.util.List;
import java.util.Objects;

/**
 * Immutable, time-ordered table of samples for a single machine.
 *
 * Validated once at the boundary:
 * - every sample has exactly {@code schema.width()} readings
 * - timestamps strictly increase
 *
 * Downstream components can then work with fixed-width vectors without re-checking shapes.
 */
public final class SensorFrame {

    private final SensorSchema schema;
    private final List<SensorSample> samples;

    public SensorFrame(SensorSchema schema, List<SensorSample> samples) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(samples, "samples must not be null");

        SensorSample previous = null;
        for (SensorSample s : samples) {
            Objects.requireNonNull(s, "samples must not contain null");
            DimensionMismatchException.check(schema.width(), s.width());
            if (previous != null && !s.timestamp().isAfter(previous.timestamp())) {
                throw new InvalidInputException(
                        "Samples must be in strictly increasing time order: " + s.timestamp()
                                + " follows " + previous.timestamp()
                );
            }
            previous = s;
        }
        this.samples = List.copyOf(samples);
    }

    public SensorSchema schema() {
        return schema;
    }

    public List<SensorSample> samples() {
        return samples;
    }

    public int size() {
        return samples.size();
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    public int width() {
        return schema.width();
    }

    public SensorSample get(int row) {
        return samples.get(row);
    }

    /**
     * Rows [fromInclusive, toExclusive) as a new frame with the same schema.
     */
    public SensorFrame slice(int fromInclusive, int toExclusive) {
        return new SensorFrame(schema, samples.subList(fromInclusive, toExclusive));
    }

    /**
     * The last {@code count} rows (or all of them if the frame is shorter).
     */
    public SensorFrame tail(int count) {
        if (count < 0) throw new IllegalArgumentException("count must be >= 0");
        int from = Math.max(0, samples.size() - count);
        return slice(from, samples.size());
    }

    /**
     * Copies one sensor's readings, in time order.
     */
    public double[] column(int sensorIndex) {
        if (sensorIndex < 0 || sensorIndex >= schema.width()) {
            throw new IndexOutOfBoundsException("sensorIndex=" + sensorIndex + ", width=" + schema.width());
        }
        double[] out = new double[samples.size()];
        for (int r = 0; r < out.length; r++) {
            out[r] = samples.get(r).readings().get(sensorIndex);
        }
        return out;
    }

    public SensorFrame withSamples(List<SensorSample> replacement) {
        return new SensorFrame(schema, replacement);
    }

    @Override
    public String toString() {
        return "SensorFrame(rows=" + samples.size() + ", sensors=" + schema.width() + ")";
    }
}
