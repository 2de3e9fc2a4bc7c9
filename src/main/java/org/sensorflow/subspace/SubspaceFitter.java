package org.sensorflow.subspace;

import org.apache.commons.math3.stat.correlation.Covariance;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.sensorflow.error.DegenerateBaselineException;
import org.sensorflow.error.DimensionMismatchException;
import org.sensorflow.linalg.Decomposition;
import org.sensorflow.linalg.EigenSolver;
import org.sensorflow.model.Vector;

import java.util.List;
import java.util.Objects;

/**
 * Learns the principal directions of a standardized baseline.
 *
 * Steps:
 * 1) Check the baseline can support a covariance estimate (M > N)
 * 2) Population covariance of the M x N matrix
 * 3) Ordered eigen decomposition through the injected {@link EigenSolver}
 * 4) Pick the reconstruction rank from the {@link ComponentPolicy}
 */
public final class SubspaceFitter {

    private static final Logger logger = LogManager.getLogger(SubspaceFitter.class);

    /** Eigenvalues below this fraction of the largest one count as zero. */
    static final double RANK_TOLERANCE = 1e-10;

    private final EigenSolver solver;
    private final ComponentPolicy policy;

    public SubspaceFitter(EigenSolver solver, ComponentPolicy policy) {
        this.solver = Objects.requireNonNull(solver, "solver must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    /**
     * @param standardizedBaseline M rows of N standardized readings (constant sensors already zeroed)
     * @param activeSensors        number of sensors that carry variance; bounds the useful rank
     * @throws DegenerateBaselineException if M <= N or the baseline has fewer independent
     *                                     directions than the visual rank
     */
    public SubspaceModel fit(List<Vector> standardizedBaseline, int activeSensors) {
        Objects.requireNonNull(standardizedBaseline, "standardizedBaseline must not be null");
        if (standardizedBaseline.isEmpty()) {
            throw new DegenerateBaselineException("Baseline is empty", 2, 0);
        }

        int m = standardizedBaseline.size();
        int n = standardizedBaseline.get(0).dim();
        if (m <= n) {
            throw new DegenerateBaselineException(
                    "Baseline must contain more samples than sensors (" + n + ")", n + 1, m);
        }

        double[][] data = new double[m][];
        for (int r = 0; r < m; r++) {
            Vector row = standardizedBaseline.get(r);
            DimensionMismatchException.check(n, row.dim());
            data[r] = row.toArrayCopy();
        }

        double[][] covariance = new Covariance(data, false).getCovarianceMatrix().getData();
        Decomposition decomposition = solver.decompose(covariance);

        int rank = decomposition.numericalRank(RANK_TOLERANCE);
        int kVisual = policy.visualComponents();
        if (rank < kVisual) {
            throw new DegenerateBaselineException(
                    "Baseline spans " + rank + " independent direction(s) but " + kVisual + " are required",
                    n + 1, m);
        }

        int kRecon = chooseReconstructionRank(decomposition, rank, Math.min(activeSensors, rank), kVisual);
        logger.debug("Fitted subspace: width={}, rank={}, kVisual={}, kRecon={}", n, rank, kVisual, kRecon);

        return new SubspaceModel(decomposition.eigenvectors().subList(0, kRecon), decomposition.eigenvalues(), kVisual);
    }

    /**
     * Smallest k reaching the variance target, clamped to [kVisual, usable], where usable stays
     * below the active rank when possible so the reconstruction residual keeps some room.
     */
    int chooseReconstructionRank(Decomposition d, int rank, int activeRank, int kVisual) {
        int usable = Math.max(kVisual, Math.min(rank, activeRank - 1));

        double total = 0.0;
        for (int i = 0; i < d.size(); i++) total += d.eigenvalue(i);

        int k = 0;
        double cumulative = 0.0;
        while (k < rank) {
            cumulative += d.eigenvalue(k);
            k++;
            if (cumulative >= policy.varianceFraction() * total) break;
        }
        return Math.max(kVisual, Math.min(k, usable));
    }
}
