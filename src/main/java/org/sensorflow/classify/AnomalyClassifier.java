package org.sensorflow.classify;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.sensorflow.error.InvalidInputException;
import org.sensorflow.model.AnomalyState;

import java.time.Instant;
import java.util.Objects;

/**
 * Turns a time-ordered stream of health scores into NORMAL / WARNING / BROKEN labels.
 *
 * Transitions (at most one per sample):
 *   NORMAL  -> WARNING  after w consecutive scores &gt; 1
 *   WARNING -> BROKEN   after b consecutive scores &gt; brokenMultiple, or w2 over-threshold samples in WARNING
 *   WARNING -> NORMAL   after w consecutive scores &lt;= 1
 *   BROKEN  -> WARNING  after b consecutive scores &lt;= 1
 *
 * Stateful and not thread-safe: one instance per machine per scoring run.
 */
public final class AnomalyClassifier {

    private static final Logger logger = LogManager.getLogger(AnomalyClassifier.class);

    private final ClassifierSettings settings;

    private AnomalyState state = AnomalyState.NORMAL;
    private int overRun;
    private int severeRun;
    private int underRun;
    private int warningDwell;
    private Instant lastTimestamp;

    public AnomalyClassifier(ClassifierSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    public AnomalyState state() {
        return state;
    }

    public ClassifierSettings settings() {
        return settings;
    }

    /**
     * Classifies the next score in the sequence.
     *
     * @throws InvalidInputException if {@code timestamp} does not strictly follow the previous one
     */
    public AnomalyState classify(Instant timestamp, double healthScore) {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        if (lastTimestamp != null && !timestamp.isAfter(lastTimestamp)) {
            throw new InvalidInputException(
                    "Scores must arrive in strictly increasing time order: " + timestamp + " after " + lastTimestamp);
        }
        AnomalyState next = classify(healthScore);
        lastTimestamp = timestamp;
        return next;
    }

    /**
     * Classifies the next score, trusting the caller for ordering.
     */
    public AnomalyState classify(double healthScore) {
        if (Double.isNaN(healthScore)) {
            throw new InvalidInputException("health score must not be NaN");
        }
        updateRuns(healthScore);

        AnomalyState next = switch (state) {
            case NORMAL -> overRun >= settings.warningDebounce() ? AnomalyState.WARNING : AnomalyState.NORMAL;
            case WARNING -> {
                if (severeRun >= settings.brokenDebounce() || warningDwell >= settings.warningEscalation()) {
                    yield AnomalyState.BROKEN;
                }
                yield underRun >= settings.warningDebounce() ? AnomalyState.NORMAL : AnomalyState.WARNING;
            }
            case BROKEN -> underRun >= settings.brokenDebounce() ? AnomalyState.WARNING : AnomalyState.BROKEN;
        };

        if (next != state) {
            logger.info("Machine state {} -> {} (score={})", state, next, healthScore);
            // each state needs its own run to be left again
            underRun = 0;
            warningDwell = 0;
            state = next;
        }
        return state;
    }

    /**
     * Back to NORMAL with no memory, as after a retrain or restart.
     */
    public void reset() {
        state = AnomalyState.NORMAL;
        overRun = 0;
        severeRun = 0;
        underRun = 0;
        warningDwell = 0;
        lastTimestamp = null;
    }

    private void updateRuns(double score) {
        if (score > 1.0) {
            overRun++;
            underRun = 0;
            if (state == AnomalyState.WARNING) {
                warningDwell++;
            }
        } else {
            underRun++;
            overRun = 0;
            warningDwell = 0;
        }
        severeRun = score > settings.brokenMultiple() ? severeRun + 1 : 0;
    }
}
