package org.sensorflow.quality;

/**
 * @param qualityScore  100 * (1 - missingCells / totalCells), 0 for an empty frame
 * @param totalSensors  number of sensor columns
 * @param rows          number of samples
 * @param missingCells  NaN readings in the frame
 */
public record DataQualitySummary(double qualityScore, int totalSensors, int rows, long missingCells) {
}
