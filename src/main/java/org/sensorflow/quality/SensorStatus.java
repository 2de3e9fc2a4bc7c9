package org.sensorflow.quality;

public enum SensorStatus {
    HEALTHY,
    WARNING,
    CRITICAL
}
