package org.sensorflow.engine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.sensorflow.config.DetectorConfig;
import org.sensorflow.error.DegenerateBaselineException;
import org.sensorflow.linalg.CommonsMathEigenSolver;
import org.sensorflow.model.BaselineRange;
import org.sensorflow.model.FitWindow;
import org.sensorflow.model.SensorFrame;
import org.sensorflow.model.SensorSample;
import org.sensorflow.model.TrainedModel;
import org.sensorflow.model.Vector;
import org.sensorflow.preprocess.Preprocessor;
import org.sensorflow.preprocess.ScaleFit;
import org.sensorflow.projection.ProjectionEngine;
import org.sensorflow.scoring.FusionSettings;
import org.sensorflow.scoring.HealthComposer;
import org.sensorflow.scoring.ResidualScorer;
import org.sensorflow.scoring.ResidualStatistics;
import org.sensorflow.scoring.ThresholdCalibrator;
import org.sensorflow.scoring.Thresholds;
import org.sensorflow.subspace.SubspaceFitter;
import org.sensorflow.subspace.SubspaceModel;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Training pass: baseline window in, immutable {@link TrainedModel} out.
 *
 * Pipeline: select baseline -> fit mean/scale -> standardize (constant sensors zeroed)
 * -> fit subspace -> score the baseline against itself -> calibrate thresholds.
 */
public final class ModelTrainer {

    private static final Logger logger = LogManager.getLogger(ModelTrainer.class);

    private final Preprocessor preprocessor;
    private final SubspaceFitter fitter;
    private final ResidualScorer residualScorer;
    private final ThresholdCalibrator calibrator;
    private final FusionSettings fusion;
    private final double percentile;

    public ModelTrainer(Preprocessor preprocessor,
                        SubspaceFitter fitter,
                        ResidualScorer residualScorer,
                        ThresholdCalibrator calibrator,
                        FusionSettings fusion,
                        double percentile) {
        this.preprocessor = Objects.requireNonNull(preprocessor, "preprocessor must not be null");
        this.fitter = Objects.requireNonNull(fitter, "fitter must not be null");
        this.residualScorer = Objects.requireNonNull(residualScorer, "residualScorer must not be null");
        this.calibrator = Objects.requireNonNull(calibrator, "calibrator must not be null");
        this.fusion = Objects.requireNonNull(fusion, "fusion must not be null");
        if (!(percentile > 0.0 && percentile <= 100.0)) {
            throw new IllegalArgumentException("percentile must be in (0, 100], got " + percentile);
        }
        this.percentile = percentile;
    }

    public static ModelTrainer fromConfig(DetectorConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        return new ModelTrainer(
                new Preprocessor(config.preprocessing().scaleEpsilon()),
                new SubspaceFitter(new CommonsMathEigenSolver(), config.subspace().toPolicy()),
                new ResidualScorer(new ProjectionEngine()),
                new ThresholdCalibrator(),
                config.fusion().toSettings(),
                config.threshold().percentile()
        );
    }

    /**
     * @throws DegenerateBaselineException if the selected baseline is too small or rank-deficient
     * @throws org.sensorflow.error.InvalidInputException if the baseline holds non-finite readings
     */
    public TrainedModel fit(SensorFrame frame, BaselineRange range) {
        Objects.requireNonNull(frame, "frame must not be null");
        Objects.requireNonNull(range, "range must not be null");

        List<SensorSample> baseline = range.select(frame);
        int width = frame.width();
        if (baseline.size() <= width) {
            throw new DegenerateBaselineException(
                    "Baseline " + range.describe() + " is too small for " + width + " sensors",
                    width + 1, baseline.size());
        }
        logger.info("Training on baseline {}: {} samples x {} sensors", range.describe(), baseline.size(), width);

        List<Vector> readings = baseline.stream().map(SensorSample::readings).toList();
        ScaleFit scaleFit = preprocessor.fitScale(readings);
        if (scaleFit.activeSensorCount() == 0) {
            throw new DegenerateBaselineException("Every sensor is constant over the baseline", width + 1, baseline.size());
        }

        List<Vector> standardized = new ArrayList<>(readings.size());
        for (Vector r : readings) {
            standardized.add(Preprocessor.activeOnly(preprocessor.standardize(r, scaleFit), scaleFit.constantSensors()));
        }

        SubspaceModel subspace = fitter.fit(standardized, scaleFit.activeSensorCount());

        List<ResidualStatistics> stats = new ArrayList<>(standardized.size());
        for (Vector z : standardized) {
            stats.add(residualScorer.score(z, subspace));
        }
        Thresholds thresholds = calibrator.calibrate(stats, new HealthComposer(fusion), percentile);

        FitWindow window = new FitWindow(
                baseline.get(0).timestamp(),
                baseline.get(baseline.size() - 1).timestamp(),
                baseline.size());

        TrainedModel model = new TrainedModel(
                frame.schema(),
                scaleFit.mean(),
                scaleFit.scale(),
                scaleFit.constantSensors(),
                subspace,
                thresholds,
                fusion,
                window);

        logger.info("Trained model: kVisual={}, kRecon={} ({}% variance), thresholds Q={}, T2={}, health={} at p{}",
                subspace.visualRank(),
                subspace.reconstructionRank(),
                String.format("%.1f", 100.0 * subspace.explainedVarianceRatio(subspace.reconstructionRank())),
                thresholds.reconstruction(),
                thresholds.subspace(),
                thresholds.health(),
                thresholds.percentile());
        return model;
    }
}
