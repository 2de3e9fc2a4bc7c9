package org.sensorflow.model;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The fixed, ordered set of sensor columns one machine reports.
 * Position i in every {@link SensorSample} belongs to {@code sensorNames().get(i)}.
 */
public record SensorSchema(List<String> sensorNames) {

    public SensorSchema {
        Objects.requireNonNull(sensorNames, "sensorNames must not be null");
        if (sensorNames.isEmpty()) {
            throw new IllegalArgumentException("A schema needs at least one sensor");
        }
        Set<String> seen = new HashSet<>();
        for (String name : sensorNames) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Sensor names must be non-empty");
            }
            if (!seen.add(name)) {
                throw new IllegalArgumentException("Duplicate sensor name: " + name);
            }
        }
        sensorNames = List.copyOf(sensorNames);
    }

    public static SensorSchema of(String... names) {
        return new SensorSchema(List.of(names));
    }

    /**
     * Generates names sensor_00, sensor_01, ... for a machine without labelled columns.
     */
    public static SensorSchema numbered(int width) {
        if (width <= 0) {
            throw new IllegalArgumentException("width must be >= 1");
        }
        String[] names = new String[width];
        for (int i = 0; i < width; i++) {
            names[i] = String.format("sensor_%02d", i);
        }
        return of(names);
    }

    public int width() {
        return sensorNames.size();
    }

    public String nameOf(int index) {
        return sensorNames.get(index);
    }

    /**
     * @return column index of the sensor, or -1 if the schema does not contain it
     */
    public int indexOf(String sensorName) {
        return sensorNames.indexOf(sensorName);
    }
}
