package org.sensorflow.scoring;

import org.sensorflow.model.Coordinate2D;
import org.sensorflow.model.Vector;

import java.util.Objects;

/**
 * Fuses the residual statistics into one health score and emits the 2D map coordinate.
 *
 * Each statistic is first divided by its own calibrated threshold, then combined per the
 * {@link FusionSettings}. The fused raw value is divided by the health threshold, so a score
 * of 1.0 sits exactly on the calibration boundary whatever the policy.
 *
 * A statistic whose threshold is numerically zero carries no information (for example a
 * reconstruction residual that vanishes because every active direction is retained) and is
 * left out of the fusion.
 */
public final class HealthComposer {

    static final double NEGLIGIBLE = 1e-9;

    private final FusionSettings settings;

    public HealthComposer(FusionSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    public FusionSettings settings() {
        return settings;
    }

    /**
     * Fused value before the final normalization, i.e. the quantity the health threshold is calibrated on.
     */
    public double rawScore(double reconstructionError, double subspaceDistance,
                           double reconstructionThreshold, double subspaceThreshold) {
        boolean hasRecon = reconstructionThreshold > NEGLIGIBLE;
        boolean hasSubspace = subspaceThreshold > NEGLIGIBLE;
        double recon = hasRecon ? reconstructionError / reconstructionThreshold : 0.0;
        double subspace = hasSubspace ? subspaceDistance / subspaceThreshold : 0.0;

        return switch (settings.policy()) {
            case RECONSTRUCTION -> hasRecon ? recon : subspace;
            case SUBSPACE -> hasSubspace ? subspace : recon;
            case BLENDED -> {
                if (hasRecon && hasSubspace) {
                    double w = settings.reconstructionWeight();
                    yield w * recon + (1.0 - w) * subspace;
                }
                yield hasRecon ? recon : subspace;
            }
        };
    }

    /**
     * @return health score; 1.0 marks the calibration boundary, higher is worse
     */
    public double compose(double reconstructionError, double subspaceDistance, Thresholds thresholds) {
        Objects.requireNonNull(thresholds, "thresholds must not be null");
        double raw = rawScore(reconstructionError, subspaceDistance, thresholds.reconstruction(), thresholds.subspace());
        return raw / thresholds.health();
    }

    public double compose(ResidualStatistics stats, Thresholds thresholds) {
        Objects.requireNonNull(stats, "stats must not be null");
        return compose(stats.reconstructionError(), stats.subspaceDistance(), thresholds);
    }

    /**
     * The first two projection scores as a map coordinate, independent of the health score.
     * A single-component model maps onto the x axis.
     */
    public static Coordinate2D coordinateOf(Vector scores) {
        Objects.requireNonNull(scores, "scores must not be null");
        double x = scores.get(0);
        double y = scores.dim() > 1 ? scores.get(1) : 0.0;
        return new Coordinate2D(x, y);
    }
}
