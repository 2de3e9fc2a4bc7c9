package org.sensorflow.model;

/**
 * Position of a sample on the first two principal components (the "health map").
 */
public record Coordinate2D(double x, double y) {

    public static final Coordinate2D ORIGIN = new Coordinate2D(0.0, 0.0);

    public double distanceFromOrigin() {
        return Math.hypot(x, y);
    }
}
