package org.sensorflow.engine;

import org.junit.jupiter.api.Test;
import org.sensorflow.SyntheticMachine;
import org.sensorflow.config.DetectorConfig;
import org.sensorflow.error.DegenerateBaselineException;
import org.sensorflow.model.RowRange;
import org.sensorflow.model.SensorFrame;
import org.sensorflow.model.SensorSample;
import org.sensorflow.model.SensorSchema;
import org.sensorflow.model.TimeRange;
import org.sensorflow.model.TrainedModel;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ModelTrainerTest {

    private final ModelTrainer trainer = ModelTrainer.fromConfig(DetectorConfig.defaults());

    @Test
    void trainsOnSelectedBaselineOnly() {
        SyntheticMachine machine = new SyntheticMachine(5L);
        SensorFrame frame = machine.frame(machine.normal(600));

        TrainedModel model = trainer.fit(frame, RowRange.firstRows(400));

        assertEquals(4, model.width());
        assertEquals(400, model.fitWindow().sampleCount());
        assertEquals(SyntheticMachine.T0, model.fitWindow().start());
        assertEquals(frame.get(399).timestamp(), model.fitWindow().end());
        assertEquals(2, model.subspace().visualRank());
        assertEquals(2, model.subspace().reconstructionRank());
        assertEquals(99.0, model.thresholds().percentile());
        assertTrue(model.thresholds().reconstruction() > 0.0);
        assertTrue(model.thresholds().subspace() > 0.0);
        assertEquals(60.0, model.mean().get(0), 1.0);
    }

    @Test
    void timeRangeSelectsSameBaselineAsRows() {
        SyntheticMachine machine = new SyntheticMachine(5L);
        SensorFrame frame = machine.frame(machine.normal(300));

        TrainedModel byRows = trainer.fit(frame, RowRange.firstRows(200));
        TrainedModel byTime = trainer.fit(frame, new TimeRange(frame.get(0).timestamp(), frame.get(199).timestamp()));

        assertEquals(byRows, byTime);
    }

    @Test
    void constantSensorIsRecordedAndExcluded() {
        SyntheticMachine machine = new SyntheticMachine(9L, true);
        TrainedModel model = trainer.fit(machine.normalFrame(300), RowRange.firstRows(300));

        assertEquals(Set.of(4), model.constantSensors());
        assertEquals(4, model.activeSensorCount());
        assertEquals(1.0, model.scale().get(4));
        // the flat sensor carries no weight in any retained direction
        model.subspace().reconstructionComponents().forEach(c -> assertEquals(0.0, c.get(4), 1e-12));
    }

    @Test
    void baselineNotLargerThanSensorCountIsDegenerate() {
        SyntheticMachine machine = new SyntheticMachine(1L);
        SensorFrame frame = machine.normalFrame(50);

        DegenerateBaselineException ex = assertThrows(DegenerateBaselineException.class,
                () -> trainer.fit(frame, RowRange.firstRows(4)));
        assertEquals(5, ex.minimumSamples());
        assertEquals(4, ex.actualSamples());
    }

    @Test
    void allConstantSensorsAreDegenerate() {
        List<SensorSample> rows = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            rows.add(SensorSample.of(SyntheticMachine.T0.plusSeconds(60L * i), 1.0, 2.0));
        }
        SensorFrame flat = new SensorFrame(SensorSchema.numbered(2), rows);
        assertThrows(DegenerateBaselineException.class, () -> trainer.fit(flat, RowRange.firstRows(20)));
    }

    @Test
    void retrainingOnSameBaselineIsDeterministic() {
        SensorFrame frame = new SyntheticMachine(21L).normalFrame(250);
        assertEquals(trainer.fit(frame, RowRange.firstRows(250)), trainer.fit(frame, RowRange.firstRows(250)));
    }
}
