package org.sensorflow.scoring;

import org.sensorflow.model.Vector;

import java.util.Objects;

/**
 * Deviation statistics of one standardized sample against the normal subspace.
 *
 * @param reconstructionError squared norm of the residual (Q statistic)
 * @param subspaceDistance    sum of score_i^2 / eigenvalue_i over retained components (T2)
 * @param scores              projection scores on the retained components
 * @param residual            standardized sample minus its reconstruction
 */
public record ResidualStatistics(double reconstructionError,
                                 double subspaceDistance,
                                 Vector scores,
                                 Vector residual) {

    public ResidualStatistics {
        Objects.requireNonNull(scores, "scores must not be null");
        Objects.requireNonNull(residual, "residual must not be null");
    }
}
