package org.sensorflow.classify;

/**
 * Debounce and escalation rules for {@link AnomalyClassifier}.
 *
 * @param warningDebounce   w: consecutive over-threshold samples to enter WARNING,
 *                          and consecutive under-threshold samples to return to NORMAL
 * @param brokenDebounce    b: consecutive samples above {@code brokenMultiple} to enter BROKEN,
 *                          and consecutive under-threshold samples to step back to WARNING
 * @param brokenMultiple    severe level as a multiple of the threshold (health score units), &gt; 1
 * @param warningEscalation w2: consecutive over-threshold samples spent in WARNING before escalating to BROKEN
 */
public record ClassifierSettings(int warningDebounce, int brokenDebounce, double brokenMultiple, int warningEscalation) {

    public static final ClassifierSettings DEFAULT = new ClassifierSettings(3, 5, 2.0, 30);

    public ClassifierSettings {
        if (warningDebounce < 1) throw new IllegalArgumentException("warningDebounce must be >= 1");
        if (brokenDebounce < 1) throw new IllegalArgumentException("brokenDebounce must be >= 1");
        if (warningEscalation < 1) throw new IllegalArgumentException("warningEscalation must be >= 1");
        if (!(brokenMultiple > 1.0) || !Double.isFinite(brokenMultiple)) {
            throw new IllegalArgumentException("brokenMultiple must be finite and > 1, got " + brokenMultiple);
        }
    }
}
