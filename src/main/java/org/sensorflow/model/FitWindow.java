package org.sensorflow.model;

import java.time.Instant;
import java.util.Objects;

/**
 * The baseline a model was trained on: first/last timestamp and sample count.
 */
public record FitWindow(Instant start, Instant end, int sampleCount) {

    public FitWindow {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end must not be before start");
        }
        if (sampleCount <= 0) {
            throw new IllegalArgumentException("sampleCount must be >= 1");
        }
    }
}
