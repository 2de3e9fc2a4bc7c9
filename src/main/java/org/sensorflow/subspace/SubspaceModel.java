package org.sensorflow.subspace;

import org.sensorflow.error.DimensionMismatchException;
import org.sensorflow.model.Vector;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Fitted linear subspace of normal operation.
 *
 * Holds the first {@code kRecon} principal components (unit-norm, mutually orthogonal,
 * descending explained variance) and the full eigen spectrum of the baseline covariance.
 * Two ranks are tracked separately:
 * - visual rank (usually 2): the components behind the 2D health-map coordinate
 * - reconstruction rank: the components that define "normal" for residual scoring
 *
 * The visual components are always the leading reconstruction components.
 */
public final class SubspaceModel {

    private final List<Vector> components;
    private final double[] eigenvalues;
    private final int visualRank;

    public SubspaceModel(List<Vector> components, double[] eigenvalues, int visualRank) {
        Objects.requireNonNull(components, "components must not be null");
        Objects.requireNonNull(eigenvalues, "eigenvalues must not be null");
        if (components.isEmpty()) {
            throw new IllegalArgumentException("At least one component is required");
        }
        if (visualRank < 1 || visualRank > components.size()) {
            throw new IllegalArgumentException(
                    "visualRank must be in [1, " + components.size() + "], got " + visualRank);
        }
        int width = components.get(0).dim();
        for (Vector c : components) {
            DimensionMismatchException.check(width, c.dim());
        }
        DimensionMismatchException.check(width, eigenvalues.length);
        if (components.size() > width) {
            throw new IllegalArgumentException(
                    "At most " + width + " components fit a width of " + width + ", got " + components.size());
        }
        for (int i = 0; i < eigenvalues.length; i++) {
            if (!(eigenvalues[i] >= 0.0) || !Double.isFinite(eigenvalues[i])) {
                throw new IllegalArgumentException("eigenvalues must be finite and >= 0");
            }
            if (i > 0 && eigenvalues[i] > eigenvalues[i - 1]) {
                throw new IllegalArgumentException("eigenvalues must be in descending order");
            }
        }
        if (eigenvalues[components.size() - 1] <= 0.0) {
            throw new IllegalArgumentException("Retained components must have positive eigenvalues");
        }

        this.components = List.copyOf(components);
        this.eigenvalues = Arrays.copyOf(eigenvalues, eigenvalues.length);
        this.visualRank = visualRank;
    }

    public int width() {
        return eigenvalues.length;
    }

    public int visualRank() {
        return visualRank;
    }

    public int reconstructionRank() {
        return components.size();
    }

    /** Leading components used for the 2D coordinate. */
    public List<Vector> visualComponents() {
        return components.subList(0, visualRank);
    }

    /** All retained components, used for reconstruction and the subspace distance. */
    public List<Vector> reconstructionComponents() {
        return components;
    }

    public double eigenvalue(int index) {
        return eigenvalues[index];
    }

    /** Full spectrum (one eigenvalue per sensor), descending. */
    public double[] eigenvalues() {
        return Arrays.copyOf(eigenvalues, eigenvalues.length);
    }

    /**
     * Share of total baseline variance explained by the first {@code k} components.
     */
    public double explainedVarianceRatio(int k) {
        if (k < 0 || k > eigenvalues.length) {
            throw new IllegalArgumentException("k must be in [0, " + eigenvalues.length + "]");
        }
        double total = 0.0;
        double head = 0.0;
        for (int i = 0; i < eigenvalues.length; i++) {
            total += eigenvalues[i];
            if (i < k) head += eigenvalues[i];
        }
        return total == 0.0 ? 0.0 : head / total;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SubspaceModel other)) return false;
        return visualRank == other.visualRank
                && components.equals(other.components)
                && Arrays.equals(eigenvalues, other.eigenvalues);
    }

    @Override
    public int hashCode() {
        return Objects.hash(components, Arrays.hashCode(eigenvalues), visualRank);
    }

    @Override
    public String toString() {
        return "SubspaceModel(width=" + width() + ", kVisual=" + visualRank + ", kRecon=" + components.size() + ")";
    }
}
