package org.sensorflow.insights;

import org.sensorflow.engine.HealthScorer;
import org.sensorflow.error.ModelNotFittedException;
import org.sensorflow.model.SensorSample;
import org.sensorflow.model.TrainedModel;
import org.sensorflow.model.Vector;
import org.sensorflow.scoring.ResidualStatistics;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Ranks sensors by how much they drive a deviation. Ranking only: no causal claim is made.
 *
 * Two rankings:
 * - per sample: each sensor's share of the squared reconstruction residual (scores sum to 1)
 * - per window: |window mean - baseline mean| / baseline scale, i.e. the mean shift in baseline sigmas
 *
 * Constant sensors are never ranked.
 */
public final class ContributionAnalyzer {

    private final HealthScorer scorer;

    public ContributionAnalyzer(HealthScorer scorer) {
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
    }

    public List<SensorContribution> rankResidual(SensorSample sample, TrainedModel model, int topN) {
        Objects.requireNonNull(sample, "sample must not be null");
        requireModel(model);
        requireTopN(topN);

        ResidualStatistics stats = scorer.statistics(sample.readings(), model);
        Vector residual = stats.residual();
        double total = stats.reconstructionError();

        List<SensorContribution> out = new ArrayList<>();
        for (int i = 0; i < model.width(); i++) {
            if (model.isConstant(i)) continue;
            double sq = residual.get(i) * residual.get(i);
            double share = total > 0.0 ? sq / total : 0.0;
            out.add(new SensorContribution(model.schema().nameOf(i), i, share,
                    sample.readings().get(i), model.mean().get(i)));
        }
        return top(out, topN);
    }

    /**
     * @param window samples of the event window (for example those inside an {@link AnomalyEvent})
     */
    public List<SensorContribution> rankMeanShift(List<SensorSample> window, TrainedModel model, int topN) {
        Objects.requireNonNull(window, "window must not be null");
        requireModel(model);
        requireTopN(topN);
        if (window.isEmpty()) {
            return List.of();
        }

        Vector windowMean = Vector.average(window.stream().map(SensorSample::readings).toList());

        List<SensorContribution> out = new ArrayList<>();
        for (int i = 0; i < model.width(); i++) {
            if (model.isConstant(i)) continue;
            double observed = windowMean.get(i);
            double baseline = model.mean().get(i);
            double sigmas = Math.abs(observed - baseline) / model.scale().get(i);
            out.add(new SensorContribution(model.schema().nameOf(i), i, sigmas, observed, baseline));
        }
        return top(out, topN);
    }

    /**
     * Mean-shift ranking over the samples that fall inside the event.
     */
    public List<SensorContribution> rankEvent(List<SensorSample> samples, AnomalyEvent event, TrainedModel model, int topN) {
        Objects.requireNonNull(samples, "samples must not be null");
        Objects.requireNonNull(event, "event must not be null");
        List<SensorSample> window = samples.stream().filter(s -> event.contains(s.timestamp())).toList();
        return rankMeanShift(window, model, topN);
    }

    private static List<SensorContribution> top(List<SensorContribution> all, int topN) {
        all.sort(Comparator.comparingDouble(SensorContribution::score).reversed()
                .thenComparingInt(SensorContribution::sensorIndex));
        return List.copyOf(all.subList(0, Math.min(topN, all.size())));
    }

    private static void requireModel(TrainedModel model) {
        if (model == null) {
            throw new ModelNotFittedException();
        }
    }

    private static void requireTopN(int topN) {
        if (topN <= 0) throw new IllegalArgumentException("topN must be >= 1");
    }
}
