package org.sensorflow.app.api.dto;

/** One ranked sensor with the observed value next to its baseline mean. */
public record ContributionView(int rank, String sensor, double score, double observed, double baseline) {
}
