package org.sensorflow.model;

import org.sensorflow.error.DimensionMismatchException;
import org.sensorflow.scoring.FusionSettings;
import org.sensorflow.scoring.Thresholds;
import org.sensorflow.subspace.SubspaceModel;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Everything learned from one baseline window of one machine.
 *
 * Immutable once built. Retraining produces a new instance that replaces this one wholesale;
 * nothing here is ever updated in place, so a published model can be shared across threads.
 */
public final class TrainedModel {

    /** Schema tag written into persisted artifacts. */
    public static final String SCHEMA_TAG = "sensorflow/trained-model";
    public static final int SCHEMA_VERSION = 1;

    private final SensorSchema schema;
    private final Vector mean;
    private final Vector scale;
    private final Set<Integer> constantSensors;
    private final SubspaceModel subspace;
    private final Thresholds thresholds;
    private final FusionSettings fusion;
    private final FitWindow fitWindow;

    public TrainedModel(SensorSchema schema,
                        Vector mean,
                        Vector scale,
                        Set<Integer> constantSensors,
                        SubspaceModel subspace,
                        Thresholds thresholds,
                        FusionSettings fusion,
                        FitWindow fitWindow) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.mean = Objects.requireNonNull(mean, "mean must not be null");
        this.scale = Objects.requireNonNull(scale, "scale must not be null");
        this.subspace = Objects.requireNonNull(subspace, "subspace must not be null");
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds must not be null");
        this.fusion = Objects.requireNonNull(fusion, "fusion must not be null");
        this.fitWindow = Objects.requireNonNull(fitWindow, "fitWindow must not be null");
        Objects.requireNonNull(constantSensors, "constantSensors must not be null");

        int width = schema.width();
        DimensionMismatchException.check(width, mean.dim());
        DimensionMismatchException.check(width, scale.dim());
        DimensionMismatchException.check(width, subspace.width());

        for (int i = 0; i < width; i++) {
            double s = scale.get(i);
            if (!(s > 0.0) || !Double.isFinite(s)) {
                throw new IllegalArgumentException("scale must be positive and finite; sensor " + schema.nameOf(i) + " has " + s);
            }
        }
        for (int idx : constantSensors) {
            if (idx < 0 || idx >= width) {
                throw new IllegalArgumentException("constant sensor index out of range: " + idx);
            }
        }
        // Sorted so equal models compare and serialize identically
        this.constantSensors = Collections.unmodifiableSortedSet(new TreeSet<>(constantSensors));
    }

    public SensorSchema schema() {
        return schema;
    }

    public int width() {
        return schema.width();
    }

    public Vector mean() {
        return mean;
    }

    public Vector scale() {
        return scale;
    }

    /**
     * Sensors whose baseline standard deviation was below epsilon. They are standardized
     * with scale 1 but excluded from every residual statistic.
     */
    public Set<Integer> constantSensors() {
        return constantSensors;
    }

    public boolean isConstant(int sensorIndex) {
        return constantSensors.contains(sensorIndex);
    }

    public int activeSensorCount() {
        return width() - constantSensors.size();
    }

    public SubspaceModel subspace() {
        return subspace;
    }

    public Thresholds thresholds() {
        return thresholds;
    }

    public FusionSettings fusion() {
        return fusion;
    }

    public FitWindow fitWindow() {
        return fitWindow;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TrainedModel other)) return false;
        return schema.equals(other.schema)
                && mean.equals(other.mean)
                && scale.equals(other.scale)
                && constantSensors.equals(other.constantSensors)
                && subspace.equals(other.subspace)
                && thresholds.equals(other.thresholds)
                && fusion.equals(other.fusion)
                && fitWindow.equals(other.fitWindow);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema, mean, scale, constantSensors, subspace, thresholds, fusion, fitWindow);
    }

    @Override
    public String toString() {
        return "TrainedModel(sensors=" + width()
                + ", kVisual=" + subspace.visualRank()
                + ", kRecon=" + subspace.reconstructionRank()
                + ", window=" + fitWindow + ")";
    }
}
