package org.sensorflow.preprocess;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.sensorflow.error.InvalidInputException;
import org.sensorflow.model.SensorFrame;
import org.sensorflow.model.SensorSample;
import org.sensorflow.model.Vector;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Resolves missing (NaN) readings before a frame reaches training or scoring.
 *
 * Sensors hold their value between reports, so a gap is filled with the last finite reading
 * of the same sensor; leading gaps take the first finite reading that follows.
 * Infinite readings are not gaps and are left for scoring to reject.
 */
public final class GapFiller {

    private static final Logger logger = LogManager.getLogger(GapFiller.class);

    /**
     * @return a new frame without NaN readings (the input frame is not modified)
     * @throws InvalidInputException if some sensor has no finite reading at all
     */
    public SensorFrame fill(SensorFrame frame) {
        Objects.requireNonNull(frame, "frame must not be null");
        if (frame.isEmpty()) {
            return frame;
        }

        int rows = frame.size();
        int width = frame.width();
        double[][] values = new double[rows][];
        for (int r = 0; r < rows; r++) {
            values[r] = frame.get(r).readings().toArrayCopy();
        }

        int filled = 0;
        for (int c = 0; c < width; c++) {
            // forward pass
            double last = Double.NaN;
            for (int r = 0; r < rows; r++) {
                if (Double.isNaN(values[r][c])) {
                    if (!Double.isNaN(last)) {
                        values[r][c] = last;
                        filled++;
                    }
                } else if (Double.isFinite(values[r][c])) {
                    last = values[r][c];
                }
            }
            // backward pass for the leading gap
            double next = Double.NaN;
            for (int r = rows - 1; r >= 0; r--) {
                if (Double.isNaN(values[r][c])) {
                    if (Double.isNaN(next)) {
                        throw new InvalidInputException(
                                "Sensor " + frame.schema().nameOf(c) + " has no finite reading to fill gaps from");
                    }
                    values[r][c] = next;
                    filled++;
                } else if (Double.isFinite(values[r][c])) {
                    next = values[r][c];
                }
            }
        }

        if (filled == 0) {
            return frame;
        }
        logger.warn("Filled {} missing reading(s) across {} sensors", filled, width);

        List<SensorSample> out = new ArrayList<>(rows);
        for (int r = 0; r < rows; r++) {
            out.add(new SensorSample(frame.get(r).timestamp(), new Vector(values[r])));
        }
        return frame.withSamples(out);
    }
}
