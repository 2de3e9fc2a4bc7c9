package org.sensorflow.scoring;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.sensorflow.error.DegenerateBaselineException;

import java.util.List;
import java.util.Objects;

/**
 * Derives anomaly cutoffs from the empirical distribution of baseline statistics.
 * Computed once per training run and never recomputed implicitly.
 */
public final class ThresholdCalibrator {

    public static final double DEFAULT_PERCENTILE = 99.0;

    /**
     * @param values     baseline statistic values
     * @param percentile percentile in (0, 100]
     */
    public double calibrate(double[] values, double percentile) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.length == 0) {
            throw new IllegalArgumentException("Cannot calibrate on an empty distribution");
        }
        if (!(percentile > 0.0 && percentile <= 100.0)) {
            throw new IllegalArgumentException("percentile must be in (0, 100], got " + percentile);
        }
        for (double v : values) {
            if (!Double.isFinite(v)) {
                throw new IllegalArgumentException("values must be finite");
            }
        }
        return new Percentile().evaluate(values, percentile);
    }

    /**
     * Calibrates the reconstruction, subspace and fused-health cutoffs at the same percentile.
     *
     * @throws DegenerateBaselineException if the fused baseline distribution has no spread above zero
     */
    public Thresholds calibrate(List<ResidualStatistics> baseline, HealthComposer composer, double percentile) {
        Objects.requireNonNull(baseline, "baseline must not be null");
        Objects.requireNonNull(composer, "composer must not be null");

        int m = baseline.size();
        double[] q = new double[m];
        double[] t2 = new double[m];
        for (int i = 0; i < m; i++) {
            q[i] = baseline.get(i).reconstructionError();
            t2[i] = baseline.get(i).subspaceDistance();
        }
        double qThreshold = calibrate(q, percentile);
        double t2Threshold = calibrate(t2, percentile);

        double[] raw = new double[m];
        for (int i = 0; i < m; i++) {
            raw[i] = composer.rawScore(q[i], t2[i], qThreshold, t2Threshold);
        }
        double healthThreshold = calibrate(raw, percentile);
        if (!(healthThreshold > HealthComposer.NEGLIGIBLE)) {
            throw new DegenerateBaselineException("Baseline statistics have no spread to calibrate against", m, m);
        }

        return new Thresholds(percentile, qThreshold, t2Threshold, healthThreshold);
    }
}
