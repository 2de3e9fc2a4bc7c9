package org.sensorflow.insights;

import org.sensorflow.model.AnomalyState;
import org.sensorflow.model.ScoredSample;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * MTBF / MTTR / uptime and downtime cost, counting BROKEN events as failures.
 */
public final class ReliabilityCalculator {

    public ReliabilityMetrics compute(List<ScoredSample> scored, List<AnomalyEvent> events) {
        Objects.requireNonNull(scored, "scored must not be null");
        Objects.requireNonNull(events, "events must not be null");
        if (scored.isEmpty()) {
            return new ReliabilityMetrics(100.0, 0, Double.POSITIVE_INFINITY, 0.0);
        }

        long broken = scored.stream().filter(s -> s.state() == AnomalyState.BROKEN).count();
        double uptime = 100.0 * (scored.size() - broken) / scored.size();

        List<AnomalyEvent> failures = failures(events);
        if (failures.isEmpty()) {
            return new ReliabilityMetrics(uptime, 0, Double.POSITIVE_INFINITY, 0.0);
        }

        double totalHours = Duration.between(
                scored.get(0).timestamp(), scored.get(scored.size() - 1).timestamp()).toMillis() / 3_600_000.0;
        double downtimeMinutes = failures.stream().mapToDouble(AnomalyEvent::durationMinutes).sum();
        double uptimeHours = totalHours - downtimeMinutes / 60.0;

        int n = failures.size();
        return new ReliabilityMetrics(uptime, n, uptimeHours / n, downtimeMinutes / n);
    }

    /**
     * Estimated cost of BROKEN downtime.
     */
    public double downtimeCost(List<AnomalyEvent> events, double costPerMinute) {
        Objects.requireNonNull(events, "events must not be null");
        if (costPerMinute < 0.0) {
            throw new IllegalArgumentException("costPerMinute must be >= 0");
        }
        return failures(events).stream().mapToDouble(AnomalyEvent::durationMinutes).sum() * costPerMinute;
    }

    private static List<AnomalyEvent> failures(List<AnomalyEvent> events) {
        return events.stream().filter(e -> e.state() == AnomalyState.BROKEN).toList();
    }
}
