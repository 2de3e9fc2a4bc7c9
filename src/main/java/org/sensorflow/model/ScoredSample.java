package org.sensorflow.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of scoring one {@link SensorSample}.
 *
 * @param timestamp          timestamp of the source sample
 * @param healthScore        fused score, 1.0 at the calibration boundary, higher is worse
 * @param coordinate         position on the first two principal components
 * @param residualMagnitude  reconstruction error (Q statistic)
 * @param subspaceDistance   T2-like statistic over the retained components
 * @param state              classifier label after this sample
 */
public record ScoredSample(Instant timestamp,
                           double healthScore,
                           Coordinate2D coordinate,
                           double residualMagnitude,
                           double subspaceDistance,
                           AnomalyState state) {

    public ScoredSample {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(coordinate, "coordinate must not be null");
        Objects.requireNonNull(state, "state must not be null");
    }

    public boolean overThreshold() {
        return healthScore > 1.0;
    }
}
