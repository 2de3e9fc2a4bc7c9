package org.sensorflow.linalg;

/**
 * The one linear-algebra capability the engine needs: decompose a symmetric
 * (covariance) matrix into ordered principal directions.
 *
 * Implementations must be deterministic, including the sign of each eigenvector,
 * so that fitting twice on the same data yields the same components.
 */
public interface EigenSolver {

    /**
     * @param symmetricMatrix square, symmetric matrix (row-major); not modified
     * @return eigenvalues in descending order with matching unit eigenvectors
     * @throws IllegalArgumentException if the matrix is not square or contains non-finite values
     */
    Decomposition decompose(double[][] symmetricMatrix);
}
