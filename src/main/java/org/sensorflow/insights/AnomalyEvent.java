package org.sensorflow.insights;

import org.sensorflow.model.AnomalyState;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A maximal run of consecutive samples sharing one non-NORMAL state.
 *
 * @param start          timestamp of the first sample in the run
 * @param end            timestamp of the last sample in the run
 * @param state          WARNING or BROKEN
 * @param maxHealthScore worst health score inside the run
 * @param sampleCount    number of samples in the run
 */
public record AnomalyEvent(Instant start, Instant end, AnomalyState state, double maxHealthScore, int sampleCount) {

    public AnomalyEvent {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        Objects.requireNonNull(state, "state must not be null");
        if (!state.isAnomalous()) {
            throw new IllegalArgumentException("An event must be WARNING or BROKEN");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end must not be before start");
        }
        if (sampleCount < 1) {
            throw new IllegalArgumentException("sampleCount must be >= 1");
        }
    }

    /**
     * First-to-last sample span; a single-sample event lasts zero minutes.
     */
    public double durationMinutes() {
        return Duration.between(start, end).toMillis() / 60_000.0;
    }

    public boolean contains(Instant t) {
        return !t.isBefore(start) && !t.isAfter(end);
    }
}
