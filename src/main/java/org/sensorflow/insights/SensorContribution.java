package org.sensorflow.insights;

/**
 * How much one sensor contributes to a deviation.
 *
 * @param sensor      sensor name
 * @param sensorIndex column index in the schema
 * @param score       contribution score (meaning depends on the ranking, see {@link ContributionAnalyzer})
 * @param observed    observed value (a reading, or the mean over an event window)
 * @param baseline    baseline mean of the sensor
 */
public record SensorContribution(String sensor, int sensorIndex, double score, double observed, double baseline) {
}
