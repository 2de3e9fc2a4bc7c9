package org.sensorflow.scoring;

/**
 * Cutoffs calibrated on the baseline at one percentile.
 *
 * @param percentile     percentile in (0, 100] the cutoffs were taken at
 * @param reconstruction cutoff for the reconstruction error (Q)
 * @param subspace       cutoff for the subspace distance (T2)
 * @param health         cutoff for the fused raw value; dividing by it puts the boundary at 1.0
 */
public record Thresholds(double percentile, double reconstruction, double subspace, double health) {

    public Thresholds {
        if (!(percentile > 0.0 && percentile <= 100.0)) {
            throw new IllegalArgumentException("percentile must be in (0, 100], got " + percentile);
        }
        requireNonNegative(reconstruction, "reconstruction");
        requireNonNegative(subspace, "subspace");
        if (!(health > 0.0) || !Double.isFinite(health)) {
            throw new IllegalArgumentException("health threshold must be positive and finite, got " + health);
        }
    }

    private static void requireNonNegative(double value, String name) {
        if (!(value >= 0.0) || !Double.isFinite(value)) {
            throw new IllegalArgumentException(name + " threshold must be finite and >= 0, got " + value);
        }
    }
}
