package org.sensorflow.scoring;

import java.util.Objects;

/**
 * Fusion policy plus the weight given to the reconstruction term when blending.
 * Stored with the trained model, because the health threshold is calibrated for exactly these settings.
 *
 * @param policy               which statistics contribute
 * @param reconstructionWeight weight in [0, 1] of the reconstruction term under {@link FusionPolicy#BLENDED}
 */
public record FusionSettings(FusionPolicy policy, double reconstructionWeight) {

    public FusionSettings {
        Objects.requireNonNull(policy, "policy must not be null");
        if (!(reconstructionWeight >= 0.0 && reconstructionWeight <= 1.0)) {
            throw new IllegalArgumentException("reconstructionWeight must be in [0, 1], got " + reconstructionWeight);
        }
    }

    public static FusionSettings blended(double reconstructionWeight) {
        return new FusionSettings(FusionPolicy.BLENDED, reconstructionWeight);
    }

    public static FusionSettings of(FusionPolicy policy) {
        return new FusionSettings(policy, 0.5);
    }
}
