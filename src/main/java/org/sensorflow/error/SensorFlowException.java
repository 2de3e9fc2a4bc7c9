package org.sensorflow.error;

/**
 * Root of the engine's error taxonomy.
 *
 * Every domain failure raised by training and scoring is a subclass of this type.
 * Nothing in the engine retries.
 */
public abstract class SensorFlowException extends RuntimeException {

    protected SensorFlowException(String message) {
        super(message);
    }

    protected SensorFlowException(String message, Throwable cause) {
        super(message, cause);
    }
}
