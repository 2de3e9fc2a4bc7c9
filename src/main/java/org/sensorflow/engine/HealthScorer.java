package org.sensorflow.engine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.sensorflow.classify.AnomalyClassifier;
import org.sensorflow.classify.ClassifierSettings;
import org.sensorflow.config.DetectorConfig;
import org.sensorflow.error.ModelNotFittedException;
import org.sensorflow.model.AnomalyState;
import org.sensorflow.model.Coordinate2D;
import org.sensorflow.model.ScoredSample;
import org.sensorflow.model.SensorFrame;
import org.sensorflow.model.SensorSample;
import org.sensorflow.model.TrainedModel;
import org.sensorflow.model.Vector;
import org.sensorflow.preprocess.Preprocessor;
import org.sensorflow.projection.ProjectionEngine;
import org.sensorflow.scoring.HealthComposer;
import org.sensorflow.scoring.ResidualScorer;
import org.sensorflow.scoring.ResidualStatistics;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Scoring pass: time-ordered samples plus a trained model in, one {@link ScoredSample} per sample out.
 *
 * The per-sample statistics are a pure function of (sample, model). The state label is not: it
 * comes from an {@link AnomalyClassifier} that lives for exactly one call of
 * {@link #score(List, TrainedModel)}, so independent machines can be scored in parallel.
 */
public final class HealthScorer {

    private static final Logger logger = LogManager.getLogger(HealthScorer.class);

    private final Preprocessor preprocessor;
    private final ResidualScorer residualScorer;
    private final ClassifierSettings classifierSettings;

    public HealthScorer(Preprocessor preprocessor, ResidualScorer residualScorer, ClassifierSettings classifierSettings) {
        this.preprocessor = Objects.requireNonNull(preprocessor, "preprocessor must not be null");
        this.residualScorer = Objects.requireNonNull(residualScorer, "residualScorer must not be null");
        this.classifierSettings = Objects.requireNonNull(classifierSettings, "classifierSettings must not be null");
    }

    public static HealthScorer fromConfig(DetectorConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        return new HealthScorer(
                new Preprocessor(config.preprocessing().scaleEpsilon()),
                new ResidualScorer(new ProjectionEngine()),
                config.classifier().toSettings()
        );
    }

    /**
     * Residual statistics of one sample. Pure.
     */
    public ResidualStatistics statistics(Vector readings, TrainedModel model) {
        Vector z = preprocessor.standardize(readings, model);
        return residualScorer.score(Preprocessor.activeOnly(z, model.constantSensors()), model.subspace());
    }

    /**
     * Health score of one sample. Pure.
     */
    public double healthOf(Vector readings, TrainedModel model) {
        ResidualStatistics stats = statistics(readings, model);
        return new HealthComposer(model.fusion()).compose(stats, model.thresholds());
    }

    /**
     * Scores one sample and advances the given classifier.
     */
    public ScoredSample score(SensorSample sample, TrainedModel model, AnomalyClassifier classifier) {
        Objects.requireNonNull(sample, "sample must not be null");
        Objects.requireNonNull(classifier, "classifier must not be null");
        if (model == null) {
            throw new ModelNotFittedException();
        }

        ResidualStatistics stats = statistics(sample.readings(), model);
        HealthComposer composer = new HealthComposer(model.fusion());
        double health = composer.compose(stats, model.thresholds());
        Coordinate2D coordinate = HealthComposer.coordinateOf(stats.scores());
        AnomalyState state = classifier.classify(sample.timestamp(), health);

        return new ScoredSample(sample.timestamp(), health, coordinate,
                stats.reconstructionError(), stats.subspaceDistance(), state);
    }

    /**
     * Scores a time-ordered run with a fresh classifier starting at NORMAL.
     *
     * @throws ModelNotFittedException if {@code model} is null
     * @throws org.sensorflow.error.DimensionMismatchException if a sample's width differs from the model's
     * @throws org.sensorflow.error.InvalidInputException if a sample is non-finite or out of time order
     */
    public List<ScoredSample> score(List<SensorSample> samples, TrainedModel model) {
        Objects.requireNonNull(samples, "samples must not be null");
        if (model == null) {
            throw new ModelNotFittedException();
        }

        AnomalyClassifier classifier = newClassifier();
        List<ScoredSample> out = new ArrayList<>(samples.size());
        for (SensorSample s : samples) {
            out.add(score(s, model, classifier));
        }

        if (logger.isDebugEnabled()) {
            long over = out.stream().filter(ScoredSample::overThreshold).count();
            logger.debug("Scored {} samples, {} over threshold, final state {}", out.size(), over, classifier.state());
        }
        return out;
    }

    public List<ScoredSample> score(SensorFrame frame, TrainedModel model) {
        Objects.requireNonNull(frame, "frame must not be null");
        return score(frame.samples(), model);
    }

    public AnomalyClassifier newClassifier() {
        return new AnomalyClassifier(classifierSettings);
    }
}
