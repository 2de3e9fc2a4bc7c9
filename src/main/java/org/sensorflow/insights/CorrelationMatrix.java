package org.sensorflow.insights;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Pairwise Pearson correlations between named sensors. Symmetric, 1.0 on the diagonal;
 * NaN where a sensor did not move over the analysed rows.
 */
public final class CorrelationMatrix {

    private final List<String> sensors;
    private final double[][] values;

    public CorrelationMatrix(List<String> sensors, double[][] values) {
        this.sensors = List.copyOf(Objects.requireNonNull(sensors, "sensors must not be null"));
        Objects.requireNonNull(values, "values must not be null");
        if (values.length != this.sensors.size()) {
            throw new IllegalArgumentException("Need one row per sensor");
        }
        this.values = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            if (values[i].length != values.length) {
                throw new IllegalArgumentException("Correlation matrix must be square");
            }
            this.values[i] = Arrays.copyOf(values[i], values[i].length);
        }
    }

    public static CorrelationMatrix empty() {
        return new CorrelationMatrix(List.of(), new double[0][0]);
    }

    public List<String> sensors() {
        return sensors;
    }

    public int size() {
        return sensors.size();
    }

    public boolean isEmpty() {
        return sensors.isEmpty();
    }

    public double get(int row, int column) {
        return values[row][column];
    }

    /**
     * @throws IllegalArgumentException if either sensor is not part of this matrix
     */
    public double get(String a, String b) {
        return values[indexOf(a)][indexOf(b)];
    }

    public double[][] toArrayCopy() {
        double[][] out = new double[values.length][];
        for (int i = 0; i < values.length; i++) out[i] = Arrays.copyOf(values[i], values[i].length);
        return out;
    }

    private int indexOf(String sensor) {
        int idx = sensors.indexOf(sensor);
        if (idx < 0) {
            throw new IllegalArgumentException("Sensor not in correlation matrix: " + sensor);
        }
        return idx;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CorrelationMatrix other)) return false;
        return sensors.equals(other.sensors) && Arrays.deepEquals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * sensors.hashCode() + Arrays.deepHashCode(values);
    }

    @Override
    public String toString() {
        return "CorrelationMatrix(sensors=" + sensors + ")";
    }
}
