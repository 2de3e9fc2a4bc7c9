package org.sensorflow.config;

import org.sensorflow.classify.ClassifierSettings;
import org.sensorflow.scoring.FusionPolicy;
import org.sensorflow.scoring.FusionSettings;
import org.sensorflow.subspace.ComponentPolicy;

import java.util.Objects;

/**
 * All tunables of the engine, grouped by the component they configure.
 * Values are validated when converted into the component settings they feed.
 */
public record DetectorConfig(Preprocessing preprocessing,
                             Subspace subspace,
                             Threshold threshold,
                             Fusion fusion,
                             Classifier classifier,
                             Business business,
                             Quality quality) {

    public DetectorConfig {
        Objects.requireNonNull(preprocessing, "preprocessing must not be null");
        Objects.requireNonNull(subspace, "subspace must not be null");
        Objects.requireNonNull(threshold, "threshold must not be null");
        Objects.requireNonNull(fusion, "fusion must not be null");
        Objects.requireNonNull(classifier, "classifier must not be null");
        Objects.requireNonNull(business, "business must not be null");
        Objects.requireNonNull(quality, "quality must not be null");
    }

    /**
     * Same values as the bundled sensorflow-defaults.json, without touching the classpath.
     */
    public static DetectorConfig defaults() {
        return new DetectorConfig(
                new Preprocessing(1e-8),
                new Subspace(2, 0.90),
                new Threshold(99.0),
                new Fusion(FusionPolicy.BLENDED, 0.5),
                new Classifier(3, 5, 2.0, 30),
                new Business(500.0),
                new Quality(500, 0.1)
        );
    }

    public record Preprocessing(double scaleEpsilon) { }

    public record Subspace(int visualComponents, double varianceFraction) {
        public ComponentPolicy toPolicy() {
            return new ComponentPolicy(visualComponents, varianceFraction);
        }
    }

    public record Threshold(double percentile) { }

    public record Fusion(FusionPolicy policy, double reconstructionWeight) {
        public FusionSettings toSettings() {
            return new FusionSettings(policy, reconstructionWeight);
        }
    }

    public record Classifier(int warningDebounce, int brokenDebounce, double brokenMultiple, int warningEscalation) {
        public ClassifierSettings toSettings() {
            return new ClassifierSettings(warningDebounce, brokenDebounce, brokenMultiple, warningEscalation);
        }
    }

    public record Business(double costPerMinute) { }

    public record Quality(int lookbackWindow, double missingRateWarning) { }
}
