package org.sensorflow.app.service;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.sensorflow.app.api.HealthEngineUseCases;
import org.sensorflow.app.api.dto.ContributionView;
import org.sensorflow.app.api.dto.HealthSummaryView;
import org.sensorflow.app.api.dto.ModelInfoView;
import org.sensorflow.config.DetectorConfig;
import org.sensorflow.engine.HealthScorer;
import org.sensorflow.engine.ModelTrainer;
import org.sensorflow.error.DimensionMismatchException;
import org.sensorflow.error.ModelNotFittedException;
import org.sensorflow.insights.AnomalyEvent;
import org.sensorflow.insights.ContributionAnalyzer;
import org.sensorflow.insights.CorrelationAnalyzer;
import org.sensorflow.insights.CorrelationMatrix;
import org.sensorflow.insights.EventSegmenter;
import org.sensorflow.insights.ReliabilityCalculator;
import org.sensorflow.insights.ReliabilityMetrics;
import org.sensorflow.insights.SensorContribution;
import org.sensorflow.io.json.ModelArtifactCodec;
import org.sensorflow.model.AnomalyState;
import org.sensorflow.model.BaselineRange;
import org.sensorflow.model.ScoredSample;
import org.sensorflow.model.SensorFrame;
import org.sensorflow.model.TrainedModel;
import org.sensorflow.quality.DataQualitySummary;
import org.sensorflow.quality.SensorHealthInspector;
import org.sensorflow.quality.SensorHealthReport;
import org.sensorflow.subspace.SubspaceModel;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Default implementation of {@link HealthEngineUseCases}.
 *
 * The published model sits in an {@link AtomicReference}: a retrain or load swaps it in one step,
 * and every scoring call reads it once, so a concurrent retrain never mixes two models in one run.
 */
public final class HealthEngineService implements HealthEngineUseCases {

    private static final Logger logger = LogManager.getLogger(HealthEngineService.class);

    private final DetectorConfig config;
    private final ModelTrainer trainer;
    private final HealthScorer scorer;
    private final EventSegmenter segmenter = new EventSegmenter();
    private final ReliabilityCalculator reliability = new ReliabilityCalculator();
    private final ContributionAnalyzer contributions;
    private final CorrelationAnalyzer correlation = new CorrelationAnalyzer();
    private final SensorHealthInspector inspector;
    private final ModelArtifactCodec codec = new ModelArtifactCodec();

    private final AtomicReference<TrainedModel> published = new AtomicReference<>();

    public HealthEngineService() {
        this(DetectorConfig.defaults());
    }

    public HealthEngineService(DetectorConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.trainer = ModelTrainer.fromConfig(config);
        this.scorer = HealthScorer.fromConfig(config);
        this.contributions = new ContributionAnalyzer(scorer);
        this.inspector = SensorHealthInspector.fromConfig(config);
    }

    public DetectorConfig config() {
        return config;
    }

    // -------------------------------------------------------------------------
    // Model lifecycle
    // -------------------------------------------------------------------------

    @Override
    public TrainedModel fit(SensorFrame frame, BaselineRange baseline) {
        TrainedModel model = trainer.fit(frame, baseline);
        publish(model);
        return model;
    }

    @Override
    public Optional<TrainedModel> currentModel() {
        return Optional.ofNullable(published.get());
    }

    @Override
    public ModelInfoView describeModel() {
        TrainedModel m = requireModel();
        SubspaceModel s = m.subspace();
        return new ModelInfoView(
                m.width(),
                m.constantSensors().size(),
                s.visualRank(),
                s.reconstructionRank(),
                s.explainedVarianceRatio(s.reconstructionRank()),
                m.thresholds().health(),
                m.fitWindow().start(),
                m.fitWindow().end(),
                m.fitWindow().sampleCount());
    }

    @Override
    public void saveModel(Path path) {
        codec.save(requireModel(), path);
    }

    @Override
    public TrainedModel loadModel(Path path) {
        TrainedModel model = codec.load(path);
        publish(model);
        return model;
    }

    private void publish(TrainedModel model) {
        TrainedModel previous = published.getAndSet(model);
        if (previous == null) {
            logger.info("Published model {}", model);
        } else {
            logger.info("Replaced model {} with {}", previous, model);
        }
    }

    private TrainedModel requireModel() {
        TrainedModel model = published.get();
        if (model == null) {
            throw new ModelNotFittedException("No model has been fitted or loaded yet");
        }
        return model;
    }

    // -------------------------------------------------------------------------
    // Scoring and insights
    // -------------------------------------------------------------------------

    @Override
    public List<ScoredSample> score(SensorFrame frame) {
        Objects.requireNonNull(frame, "frame must not be null");
        TrainedModel model = requireModel();
        DimensionMismatchException.check(model.width(), frame.width());
        return scorer.score(frame, model);
    }

    @Override
    public List<AnomalyEvent> events(List<ScoredSample> scored) {
        return segmenter.segment(scored);
    }

    @Override
    public HealthSummaryView summarize(List<ScoredSample> scored) {
        Objects.requireNonNull(scored, "scored must not be null");
        List<AnomalyEvent> events = segmenter.segment(scored);
        ReliabilityMetrics metrics = reliability.compute(scored, events);
        double cost = reliability.downtimeCost(events, config.business().costPerMinute());

        AnomalyState latestState = AnomalyState.NORMAL;
        double latestScore = 0.0;
        if (!scored.isEmpty()) {
            ScoredSample last = scored.get(scored.size() - 1);
            latestState = last.state();
            latestScore = last.healthScore();
        }
        return new HealthSummaryView(scored.size(), latestState, latestScore, events, metrics, cost);
    }

    @Override
    public List<ContributionView> contributorsFor(SensorFrame frame, AnomalyEvent event, int topN) {
        Objects.requireNonNull(frame, "frame must not be null");
        return toViews(contributions.rankEvent(frame.samples(), event, requireModel(), topN));
    }

    @Override
    public List<ContributionView> contributorsFor(SensorFrame frame, int sampleIndex, int topN) {
        Objects.requireNonNull(frame, "frame must not be null");
        return toViews(contributions.rankResidual(frame.get(sampleIndex), requireModel(), topN));
    }

    private static List<ContributionView> toViews(List<SensorContribution> ranked) {
        List<ContributionView> out = new ArrayList<>(ranked.size());
        for (int i = 0; i < ranked.size(); i++) {
            SensorContribution c = ranked.get(i);
            out.add(new ContributionView(i + 1, c.sensor(), c.score(), c.observed(), c.baseline()));
        }
        return out;
    }

    @Override
    public CorrelationMatrix correlations(SensorFrame frame, List<String> sensorNames) {
        return correlation.correlations(frame, sensorNames);
    }

    // -------------------------------------------------------------------------
    // Data quality
    // -------------------------------------------------------------------------

    @Override
    public List<SensorHealthReport> sensorHealth(SensorFrame frame) {
        return inspector.inspect(frame);
    }

    @Override
    public DataQualitySummary dataQuality(SensorFrame frame) {
        return inspector.summarize(frame);
    }
}
