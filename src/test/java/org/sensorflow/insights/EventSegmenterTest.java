package org.sensorflow.insights;

import org.junit.jupiter.api.Test;
import org.sensorflow.model.AnomalyState;
import org.sensorflow.model.Coordinate2D;
import org.sensorflow.model.ScoredSample;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.sensorflow.model.AnomalyState.BROKEN;
import static org.sensorflow.model.AnomalyState.NORMAL;
import static org.sensorflow.model.AnomalyState.WARNING;

class EventSegmenterTest {

    private static final Instant T0 = Instant.parse("2018-04-01T00:00:00Z");

    private final EventSegmenter segmenter = new EventSegmenter();

    static List<ScoredSample> run(Duration step, AnomalyState... states) {
        List<ScoredSample> out = new ArrayList<>();
        for (int i = 0; i < states.length; i++) {
            double health = states[i] == NORMAL ? 0.5 : 1.0 + i;
            out.add(new ScoredSample(T0.plus(step.multipliedBy(i)), health, Coordinate2D.ORIGIN, 0.0, 0.0, states[i]));
        }
        return out;
    }

    @Test
    void groupsConsecutiveStatesNewestFirst() {
        List<AnomalyEvent> events = segmenter.segment(run(Duration.ofMinutes(1),
                NORMAL, WARNING, WARNING, BROKEN, BROKEN, BROKEN, WARNING, NORMAL, WARNING));

        assertEquals(4, events.size());

        AnomalyEvent newest = events.get(0);
        assertEquals(WARNING, newest.state());
        assertEquals(T0.plusSeconds(8 * 60), newest.start());
        assertEquals(1, newest.sampleCount());
        assertEquals(0.0, newest.durationMinutes());

        AnomalyEvent broken = events.get(2);
        assertEquals(BROKEN, broken.state());
        assertEquals(T0.plusSeconds(3 * 60), broken.start());
        assertEquals(T0.plusSeconds(5 * 60), broken.end());
        assertEquals(3, broken.sampleCount());
        assertEquals(2.0, broken.durationMinutes(), 1e-12);
        assertEquals(6.0, broken.maxHealthScore(), 1e-12);
    }

    @Test
    void healthyRunHasNoEvents() {
        assertTrue(segmenter.segment(run(Duration.ofMinutes(1), NORMAL, NORMAL, NORMAL)).isEmpty());
        assertTrue(segmenter.segment(List.of()).isEmpty());
    }

    @Test
    void eventContainsItsBounds() {
        AnomalyEvent e = new AnomalyEvent(T0, T0.plusSeconds(60), WARNING, 2.0, 2);
        assertTrue(e.contains(T0));
        assertTrue(e.contains(T0.plusSeconds(60)));
        assertFalse(e.contains(T0.plusSeconds(61)));
        assertThrows(IllegalArgumentException.class, () -> new AnomalyEvent(T0, T0, NORMAL, 0.0, 1));
    }
}
