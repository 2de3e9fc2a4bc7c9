package org.sensorflow.error;

/**
 * A vector's width does not match the width the model (or the other operand) was built for.
 * The sample is rejected as a whole; partial scoring is never attempted.
 */
public final class DimensionMismatchException extends SensorFlowException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("Dimension mismatch: expected " + expected + " but got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }

    /**
     * Throws when {@code actual != expected}.
     */
    public static void check(int expected, int actual) {
        if (expected != actual) {
            throw new DimensionMismatchException(expected, actual);
        }
    }
}
