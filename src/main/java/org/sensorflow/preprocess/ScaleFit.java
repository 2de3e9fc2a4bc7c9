package org.sensorflow.preprocess;

import org.sensorflow.error.DimensionMismatchException;
import org.sensorflow.model.Vector;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Per-sensor location and scale learned from a baseline.
 *
 * @param mean            per-sensor baseline mean
 * @param scale           per-sensor baseline standard deviation, 1 for constant sensors (never 0)
 * @param constantSensors indices whose standard deviation fell below epsilon
 */
public record ScaleFit(Vector mean, Vector scale, Set<Integer> constantSensors) {

    public ScaleFit {
        Objects.requireNonNull(mean, "mean must not be null");
        Objects.requireNonNull(scale, "scale must not be null");
        Objects.requireNonNull(constantSensors, "constantSensors must not be null");
        DimensionMismatchException.check(mean.dim(), scale.dim());
        for (int i = 0; i < scale.dim(); i++) {
            if (!(scale.get(i) > 0.0)) {
                throw new IllegalArgumentException("scale must be positive at index " + i);
            }
        }
        constantSensors = Collections.unmodifiableSortedSet(new TreeSet<>(constantSensors));
    }

    public int width() {
        return mean.dim();
    }

    public int activeSensorCount() {
        return width() - constantSensors.size();
    }
}
