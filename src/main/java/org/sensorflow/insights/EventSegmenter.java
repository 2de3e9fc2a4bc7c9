package org.sensorflow.insights;

import org.sensorflow.model.AnomalyState;
import org.sensorflow.model.ScoredSample;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Groups a scored, time-ordered run into anomaly events: a new event starts whenever the state changes.
 */
public final class EventSegmenter {

    /**
     * @return WARNING and BROKEN events, newest first
     */
    public List<AnomalyEvent> segment(List<ScoredSample> scored) {
        Objects.requireNonNull(scored, "scored must not be null");

        List<AnomalyEvent> events = new ArrayList<>();
        int i = 0;
        while (i < scored.size()) {
            AnomalyState state = scored.get(i).state();
            int j = i;
            double max = Double.NEGATIVE_INFINITY;
            while (j < scored.size() && scored.get(j).state() == state) {
                max = Math.max(max, scored.get(j).healthScore());
                j++;
            }
            if (state.isAnomalous()) {
                Instant start = scored.get(i).timestamp();
                Instant end = scored.get(j - 1).timestamp();
                events.add(new AnomalyEvent(start, end, state, max, j - i));
            }
            i = j;
        }

        events.sort(Comparator.comparing(AnomalyEvent::start).reversed());
        return events;
    }
}
