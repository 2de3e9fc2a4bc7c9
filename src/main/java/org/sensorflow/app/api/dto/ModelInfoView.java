package org.sensorflow.app.api.dto;

import java.time.Instant;

/**
 * Read-only description of the published model.
 */
public record ModelInfoView(int sensors,
                            int constantSensors,
                            int visualComponents,
                            int reconstructionComponents,
                            double explainedVariance,
                            double healthThreshold,
                            Instant fitStart,
                            Instant fitEnd,
                            int fitSamples) {
}
