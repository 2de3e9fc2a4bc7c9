package org.sensorflow.engine;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.sensorflow.SyntheticMachine;
import org.sensorflow.config.DetectorConfig;
import org.sensorflow.error.DimensionMismatchException;
import org.sensorflow.error.InvalidInputException;
import org.sensorflow.error.ModelNotFittedException;
import org.sensorflow.model.AnomalyState;
import org.sensorflow.model.RowRange;
import org.sensorflow.model.ScoredSample;
import org.sensorflow.model.SensorSample;
import org.sensorflow.model.TrainedModel;
import org.sensorflow.model.Vector;
import org.sensorflow.scoring.ResidualStatistics;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HealthScorerTest {

    private static TrainedModel model;
    private static final HealthScorer scorer = HealthScorer.fromConfig(DetectorConfig.defaults());

    @BeforeAll
    static void train() {
        model = ModelTrainer.fromConfig(DetectorConfig.defaults())
                .fit(new SyntheticMachine(100L).normalFrame(500), RowRange.firstRows(500));
    }

    @Test
    void scoresEverySampleInOrder() {
        List<SensorSample> run = new SyntheticMachine(200L).normal(50);
        List<ScoredSample> scored = scorer.score(run, model);

        assertEquals(50, scored.size());
        for (int i = 0; i < run.size(); i++) {
            assertEquals(run.get(i).timestamp(), scored.get(i).timestamp());
            assertTrue(scored.get(i).healthScore() >= 0.0);
        }
    }

    @Test
    void coordinateIsFirstTwoScores() {
        SensorSample sample = new SyntheticMachine(3L).next();
        ResidualStatistics stats = scorer.statistics(sample.readings(), model);
        ScoredSample scored = scorer.score(List.of(sample), model).get(0);

        assertEquals(stats.scores().get(0), scored.coordinate().x(), 1e-12);
        assertEquals(stats.scores().get(1), scored.coordinate().y(), 1e-12);
        assertEquals(stats.reconstructionError(), scored.residualMagnitude(), 1e-12);
        assertEquals(stats.subspaceDistance(), scored.subspaceDistance(), 1e-12);
    }

    @Test
    void baselineMeanIsPerfectlyHealthy() {
        assertEquals(0.0, scorer.healthOf(model.mean(), model), 1e-9);
    }

    @Test
    void eachRunStartsNormal() {
        SyntheticMachine machine = new SyntheticMachine(8L);
        List<SensorSample> faulty = machine.faulty(10, 0, 10.0);
        assertEquals(AnomalyState.BROKEN, scorer.score(faulty, model).get(9).state());

        List<SensorSample> healthy = machine.normal(1);
        assertEquals(AnomalyState.NORMAL, scorer.score(healthy, model).get(0).state());
    }

    @Test
    void invalidSamplesAreRejected() {
        assertThrows(DimensionMismatchException.class,
                () -> scorer.healthOf(Vector.of(1, 2, 3), model));
        assertThrows(InvalidInputException.class,
                () -> scorer.healthOf(Vector.of(60, Double.NaN, 12, 5), model));
        assertThrows(ModelNotFittedException.class,
                () -> scorer.score(new SyntheticMachine(1L).normal(1), null));
    }
}
