package org.sensorflow.insights;

/**
 * Operator-facing reliability summary of a scored run.
 *
 * @param uptimePercent share of samples not labelled BROKEN, in percent
 * @param failureCount  number of BROKEN events
 * @param mtbfHours     mean time between failures in hours (+Infinity with no failures)
 * @param mttrMinutes   mean time to repair in minutes (0 with no failures)
 */
public record ReliabilityMetrics(double uptimePercent, int failureCount, double mtbfHours, double mttrMinutes) {
}
