package org.sensorflow.quality;

/**
 * Data-quality verdict for one sensor over the inspection window.
 *
 * @param currentValue last reading in the window (may be NaN)
 */
public record SensorHealthReport(String sensor, SensorStatus status, String details, double currentValue) {
}
