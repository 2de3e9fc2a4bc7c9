package org.sensorflow.quality;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.sensorflow.config.DetectorConfig;
import org.sensorflow.model.SensorFrame;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Flags sensors whose recent data cannot be trusted.
 *
 * Checked over the last {@code lookbackWindow} samples, first match wins:
 * 1) zero variance: the sensor is stuck (CRITICAL)
 * 2) missing-value rate above {@code missingRateWarning} (WARNING)
 */
public final class SensorHealthInspector {

    private static final Logger logger = LogManager.getLogger(SensorHealthInspector.class);

    private final int lookbackWindow;
    private final double missingRateWarning;

    public SensorHealthInspector(int lookbackWindow, double missingRateWarning) {
        if (lookbackWindow < 1) {
            throw new IllegalArgumentException("lookbackWindow must be >= 1");
        }
        if (!(missingRateWarning >= 0.0 && missingRateWarning <= 1.0)) {
            throw new IllegalArgumentException("missingRateWarning must be in [0, 1]");
        }
        this.lookbackWindow = lookbackWindow;
        this.missingRateWarning = missingRateWarning;
    }

    public static SensorHealthInspector fromConfig(DetectorConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        return new SensorHealthInspector(config.quality().lookbackWindow(), config.quality().missingRateWarning());
    }

    public List<SensorHealthReport> inspect(SensorFrame frame) {
        Objects.requireNonNull(frame, "frame must not be null");
        if (frame.isEmpty()) {
            return List.of();
        }

        SensorFrame recent = frame.tail(lookbackWindow);
        List<SensorHealthReport> reports = new ArrayList<>(frame.width());

        for (int c = 0; c < frame.width(); c++) {
            double[] column = recent.column(c);
            DescriptiveStatistics stats = new DescriptiveStatistics();
            int missing = 0;
            for (double v : column) {
                if (Double.isNaN(v)) {
                    missing++;
                } else {
                    stats.addValue(v);
                }
            }

            SensorStatus status = SensorStatus.HEALTHY;
            String details = "Normal operation";
            if (stats.getN() > 1 && stats.getStandardDeviation() == 0.0) {
                status = SensorStatus.CRITICAL;
                details = "Flatline (Zero Variance)";
            } else if ((double) missing / column.length > missingRateWarning) {
                status = SensorStatus.WARNING;
                details = "High Missing Data Rate";
            }

            String name = frame.schema().nameOf(c);
            if (status != SensorStatus.HEALTHY) {
                logger.warn("Sensor {} is {}: {}", name, status, details);
            }
            reports.add(new SensorHealthReport(name, status, details, column[column.length - 1]));
        }
        return reports;
    }

    public DataQualitySummary summarize(SensorFrame frame) {
        Objects.requireNonNull(frame, "frame must not be null");
        long total = (long) frame.size() * frame.width();
        long missing = 0;
        for (int c = 0; c < frame.width(); c++) {
            for (double v : frame.column(c)) {
                if (Double.isNaN(v)) missing++;
            }
        }
        double score = total > 0 ? 100.0 * (1.0 - (double) missing / total) : 0.0;
        return new DataQualitySummary(score, frame.width(), frame.size(), missing);
    }
}
