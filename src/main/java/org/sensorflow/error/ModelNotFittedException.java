package org.sensorflow.error;

/** Scoring was requested before any model was trained or published. */
public final class ModelNotFittedException extends SensorFlowException {

    public ModelNotFittedException() {
        super("No trained model: fit a baseline before scoring");
    }

    public ModelNotFittedException(String message) {
        super(message);
    }
}
