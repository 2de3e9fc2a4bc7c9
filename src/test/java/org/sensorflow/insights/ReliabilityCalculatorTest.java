package org.sensorflow.insights;

import org.junit.jupiter.api.Test;
import org.sensorflow.model.AnomalyState;
import org.sensorflow.model.ScoredSample;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReliabilityCalculatorTest {

    private final ReliabilityCalculator calculator = new ReliabilityCalculator();
    private final EventSegmenter segmenter = new EventSegmenter();

    /**
     * 41 half-hourly samples (20 hours) with two BROKEN stretches of three samples (60 minutes each).
     */
    private static List<ScoredSample> twoFailures() {
        AnomalyState[] states = new AnomalyState[41];
        Arrays.fill(states, AnomalyState.NORMAL);
        for (int i = 10; i <= 12; i++) states[i] = AnomalyState.BROKEN;
        for (int i = 30; i <= 32; i++) states[i] = AnomalyState.BROKEN;
        states[9] = AnomalyState.WARNING;
        return EventSegmenterTest.run(Duration.ofMinutes(30), states);
    }

    @Test
    void mtbfAndMttrCountBrokenEventsOnly() {
        List<ScoredSample> scored = twoFailures();
        ReliabilityMetrics m = calculator.compute(scored, segmenter.segment(scored));

        assertEquals(2, m.failureCount());
        // (20h - 2h downtime) / 2 failures
        assertEquals(9.0, m.mtbfHours(), 1e-9);
        assertEquals(60.0, m.mttrMinutes(), 1e-9);
        assertEquals(100.0 * 35 / 41, m.uptimePercent(), 1e-9);
    }

    @Test
    void downtimeCostUsesBrokenMinutes() {
        List<ScoredSample> scored = twoFailures();
        assertEquals(120.0 * 500.0, calculator.downtimeCost(segmenter.segment(scored), 500.0), 1e-9);
        assertThrows(IllegalArgumentException.class, () -> calculator.downtimeCost(List.of(), -1.0));
    }

    @Test
    void noFailuresMeansInfiniteMtbf() {
        List<ScoredSample> scored = EventSegmenterTest.run(Duration.ofMinutes(1),
                AnomalyState.NORMAL, AnomalyState.WARNING, AnomalyState.NORMAL);
        ReliabilityMetrics m = calculator.compute(scored, segmenter.segment(scored));

        assertEquals(0, m.failureCount());
        assertEquals(Double.POSITIVE_INFINITY, m.mtbfHours());
        assertEquals(0.0, m.mttrMinutes());
        assertEquals(100.0, m.uptimePercent(), 1e-12);
    }

    @Test
    void emptyRunIsFullyAvailable() {
        ReliabilityMetrics m = calculator.compute(List.of(), List.of());
        assertEquals(100.0, m.uptimePercent());
        assertEquals(0, m.failureCount());
    }
}
