package org.sensorflow.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One time-stamped row of sensor readings. Readings may still contain NaN here;
 * scoring rejects any sample that is not fully finite.
 */
public record SensorSample(Instant timestamp, Vector readings) {

    public SensorSample {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(readings, "readings must not be null");
    }

    public static SensorSample of(Instant timestamp, double... readings) {
        return new SensorSample(timestamp, new Vector(readings));
    }

    public int width() {
        return readings.dim();
    }
}
