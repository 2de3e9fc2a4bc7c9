package org.sensorflow.app.api.dto;

import org.sensorflow.insights.AnomalyEvent;
import org.sensorflow.insights.ReliabilityMetrics;
import org.sensorflow.model.AnomalyState;

import java.util.List;

/** Summary of one scored run, ready for a report or dashboard. */
public record HealthSummaryView(int samples,
                                AnomalyState latestState,
                                double latestHealthScore,
                                List<AnomalyEvent> events,
                                ReliabilityMetrics reliability,
                                double downtimeCost) {

    public HealthSummaryView {
        events = List.copyOf(events);
    }
}
