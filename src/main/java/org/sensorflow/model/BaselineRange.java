package org.sensorflow.model;

import java.util.List;

/**
 * Which part of a frame is designated "known normal" for training.
 * Implementations select rows; the trainer decides whether the selection is large enough.
 */
public interface BaselineRange {

    /**
     * @return the selected samples, in time order (may be empty)
     */
    List<SensorSample> select(SensorFrame frame);

    /**
     * Human-readable description used in logs and errors.
     */
    String describe();
}
