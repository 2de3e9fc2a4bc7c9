package org.sensorflow.app.api;

import org.sensorflow.app.api.dto.ContributionView;
import org.sensorflow.app.api.dto.HealthSummaryView;
import org.sensorflow.app.api.dto.ModelInfoView;
import org.sensorflow.insights.AnomalyEvent;
import org.sensorflow.insights.CorrelationMatrix;
import org.sensorflow.model.BaselineRange;
import org.sensorflow.model.ScoredSample;
import org.sensorflow.model.SensorFrame;
import org.sensorflow.model.TrainedModel;
import org.sensorflow.quality.DataQualitySummary;
import org.sensorflow.quality.SensorHealthReport;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Application boundary of the health engine.
 * Callers never touch the engine packages directly; they fit, score and query through here.
 */
public interface HealthEngineUseCases {

    /**
     * Fits a model on the baseline slice of the frame and publishes it, replacing any previous one.
     */
    TrainedModel fit(SensorFrame frame, BaselineRange baseline);

    Optional<TrainedModel> currentModel();

    ModelInfoView describeModel();

    List<ScoredSample> score(SensorFrame frame);

    List<AnomalyEvent> events(List<ScoredSample> scored);

    HealthSummaryView summarize(List<ScoredSample> scored);

    List<ContributionView> contributorsFor(SensorFrame frame, AnomalyEvent event, int topN);

    List<ContributionView> contributorsFor(SensorFrame frame, int sampleIndex, int topN);

    /**
     * Pearson correlations between the named sensors, in the given order.
     */
    CorrelationMatrix correlations(SensorFrame frame, List<String> sensorNames);

    List<SensorHealthReport> sensorHealth(SensorFrame frame);

    DataQualitySummary dataQuality(SensorFrame frame);

    void saveModel(Path path);

    TrainedModel loadModel(Path path);
}
