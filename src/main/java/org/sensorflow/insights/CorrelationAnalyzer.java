package org.sensorflow.insights;

import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.sensorflow.error.InvalidInputException;
import org.sensorflow.model.SensorFrame;
import org.sensorflow.model.SensorSample;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Correlation matrix over a chosen set of sensor columns.
 *
 * Rows where any chosen sensor is missing or non-finite are skipped as a whole.
 */
public final class CorrelationAnalyzer {

    private static final Logger logger = LogManager.getLogger(CorrelationAnalyzer.class);

    /**
     * @param sensorNames sensors to correlate, in the order of the returned matrix; empty gives an empty matrix
     * @throws InvalidInputException if a sensor is unknown or fewer than two complete rows remain
     */
    public CorrelationMatrix correlations(SensorFrame frame, List<String> sensorNames) {
        Objects.requireNonNull(frame, "frame must not be null");
        Objects.requireNonNull(sensorNames, "sensorNames must not be null");
        if (sensorNames.isEmpty()) {
            return CorrelationMatrix.empty();
        }

        int[] columns = new int[sensorNames.size()];
        for (int i = 0; i < columns.length; i++) {
            columns[i] = frame.schema().indexOf(sensorNames.get(i));
            if (columns[i] < 0) {
                throw new InvalidInputException("Unknown sensor: " + sensorNames.get(i));
            }
        }

        List<double[]> rows = new ArrayList<>(frame.size());
        for (SensorSample s : frame.samples()) {
            double[] row = new double[columns.length];
            boolean complete = true;
            for (int i = 0; i < columns.length && complete; i++) {
                row[i] = s.readings().get(columns[i]);
                complete = Double.isFinite(row[i]);
            }
            if (complete) rows.add(row);
        }
        if (rows.size() < 2) {
            throw new InvalidInputException("Need at least 2 complete rows to correlate, got " + rows.size());
        }
        if (rows.size() < frame.size()) {
            logger.debug("Correlating {} of {} rows; the rest have gaps", rows.size(), frame.size());
        }

        double[][] values;
        if (columns.length == 1) {
            values = new double[][]{{1.0}};
        } else {
            values = new PearsonsCorrelation(rows.toArray(new double[0][])).getCorrelationMatrix().getData();
        }
        return new CorrelationMatrix(sensorNames, values);
    }
}
