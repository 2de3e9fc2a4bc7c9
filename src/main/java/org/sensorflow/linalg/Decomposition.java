package org.sensorflow.linalg;

import org.sensorflow.model.Vector;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Eigen decomposition of a symmetric matrix, ordered by descending eigenvalue.
 *
 * @param eigenvalues  all eigenvalues, descending, negatives from round-off clamped to 0
 * @param eigenvectors unit-norm eigenvectors; {@code eigenvectors.get(i)} belongs to {@code eigenvalues[i]}
 */
public record Decomposition(double[] eigenvalues, List<Vector> eigenvectors) {

    public Decomposition {
        Objects.requireNonNull(eigenvalues, "eigenvalues must not be null");
        Objects.requireNonNull(eigenvectors, "eigenvectors must not be null");
        if (eigenvalues.length != eigenvectors.size()) {
            throw new IllegalArgumentException("Need one eigenvector per eigenvalue");
        }
        eigenvalues = Arrays.copyOf(eigenvalues, eigenvalues.length);
        eigenvectors = List.copyOf(eigenvectors);
    }

    @Override
    public double[] eigenvalues() {
        return Arrays.copyOf(eigenvalues, eigenvalues.length);
    }

    public int size() {
        return eigenvalues.length;
    }

    public double eigenvalue(int i) {
        return eigenvalues[i];
    }

    /**
     * Number of eigenvalues above a relative tolerance of the largest one.
     */
    public int numericalRank(double relativeTolerance) {
        if (eigenvalues.length == 0 || eigenvalues[0] <= 0.0) {
            return 0;
        }
        double cutoff = eigenvalues[0] * relativeTolerance;
        int rank = 0;
        for (double ev : eigenvalues) {
            if (ev > cutoff) rank++;
        }
        return rank;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Decomposition other)) return false;
        return Arrays.equals(eigenvalues, other.eigenvalues) && eigenvectors.equals(other.eigenvectors);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(eigenvalues) + eigenvectors.hashCode();
    }

    @Override
    public String toString() {
        return "Decomposition(size=" + eigenvalues.length + ")";
    }
}
