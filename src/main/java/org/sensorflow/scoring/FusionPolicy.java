package org.sensorflow.scoring;

/**
 * How the two residual statistics become one health value.
 */
public enum FusionPolicy {
    /**
     * Reconstruction error only: catches behavior orthogonal to the normal subspace.
     * Misses faults that stay inside the retained subspace, e.g. a single-sensor offset on a
     * machine whose sensors are independent and mostly retained.
     */
    RECONSTRUCTION,
    /** Subspace distance only: catches unusual combinations of known variation. */
    SUBSPACE,
    /** Weighted sum of both, each normalized by its own calibrated threshold. */
    BLENDED
}
