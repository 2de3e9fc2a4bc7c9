package org.sensorflow.error;

/**
 * The baseline window cannot support a covariance estimate: too few samples,
 * or fewer independent directions than the model needs.
 */
public final class DegenerateBaselineException extends SensorFlowException {

    private final int minimumSamples;
    private final int actualSamples;

    public DegenerateBaselineException(String reason, int minimumSamples, int actualSamples) {
        super(reason + " (baseline has " + actualSamples + " samples, at least " + minimumSamples + " required)");
        this.minimumSamples = minimumSamples;
        this.actualSamples = actualSamples;
    }

    public int minimumSamples() {
        return minimumSamples;
    }

    public int actualSamples() {
        return actualSamples;
    }
}
