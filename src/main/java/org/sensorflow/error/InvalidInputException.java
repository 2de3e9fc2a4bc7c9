package org.sensorflow.error;

/**
 * Input that was not resolved upstream: NaN or infinite readings, out-of-order timestamps,
 * unreadable artifacts. Rejected as-is; the engine never zeroes or imputes silently.
 */
public final class InvalidInputException extends SensorFlowException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
