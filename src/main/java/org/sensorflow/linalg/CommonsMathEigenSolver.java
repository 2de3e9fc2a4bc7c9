package org.sensorflow.linalg;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.sensorflow.model.Vector;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

/**
 * {@link EigenSolver} backed by Apache Commons Math.
 *
 * Commons Math does not promise an ordering or a sign, so both are fixed here:
 * eigenpairs are sorted by descending eigenvalue, and each eigenvector is flipped so that
 * its largest-magnitude entry (first one on ties) is positive.
 */
public final class CommonsMathEigenSolver implements EigenSolver {

    @Override
    public Decomposition decompose(double[][] symmetricMatrix) {
        validate(symmetricMatrix);
        int n = symmetricMatrix.length;

        RealMatrix matrix = new Array2DRowRealMatrix(symmetricMatrix, true);
        EigenDecomposition eigen = new EigenDecomposition(matrix);
        double[] raw = eigen.getRealEigenvalues();

        Integer[] order = IntStream.range(0, n).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> raw[i]).reversed()
                .thenComparingInt(i -> i));

        double[] values = new double[n];
        List<Vector> vectors = new ArrayList<>(n);
        for (int rank = 0; rank < n; rank++) {
            int idx = order[rank];
            values[rank] = Math.max(0.0, raw[idx]);
            vectors.add(canonicalSign(eigen.getEigenvector(idx)));
        }
        return new Decomposition(values, vectors);
    }

    private static Vector canonicalSign(RealVector v) {
        double[] a = v.toArray();
        double norm = v.getNorm();
        int pivot = 0;
        for (int i = 1; i < a.length; i++) {
            if (Math.abs(a[i]) > Math.abs(a[pivot])) pivot = i;
        }
        double sign = a[pivot] < 0 ? -1.0 : 1.0;
        for (int i = 0; i < a.length; i++) {
            a[i] = sign * a[i] / norm;
        }
        return new Vector(a);
    }

    private static void validate(double[][] m) {
        if (m == null || m.length == 0) {
            throw new IllegalArgumentException("matrix must not be null or empty");
        }
        for (double[] row : m) {
            if (row == null || row.length != m.length) {
                throw new IllegalArgumentException("matrix must be square");
            }
            for (double x : row) {
                if (!Double.isFinite(x)) {
                    throw new IllegalArgumentException("matrix contains non-finite values");
                }
            }
        }
    }
}
