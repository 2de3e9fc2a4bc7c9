package org.sensorflow.model;

/**
 * Discrete machine-health label, ordered by severity.
 */
public enum AnomalyState {
    NORMAL,
    WARNING,
    BROKEN;

    public boolean isAnomalous() {
        return this != NORMAL;
    }
}
