package org.sensorflow.linalg;

import org.junit.jupiter.api.Test;
import org.sensorflow.model.Vector;

import static org.junit.jupiter.api.Assertions.*;

class CommonsMathEigenSolverTest {

    private final EigenSolver solver = new CommonsMathEigenSolver();

    @Test
    void sortsEigenpairsDescending() {
        Decomposition d = solver.decompose(new double[][]{
                {1, 0, 0},
                {0, 3, 0},
                {0, 0, 2}
        });

        assertArrayEquals(new double[]{3, 2, 1}, d.eigenvalues(), 1e-12);
        assertVector(Vector.of(0, 1, 0), d.eigenvectors().get(0));
        assertVector(Vector.of(0, 0, 1), d.eigenvectors().get(1));
        assertVector(Vector.of(1, 0, 0), d.eigenvectors().get(2));
    }

    private static void assertVector(Vector expected, Vector actual) {
        assertArrayEquals(expected.toArrayCopy(), actual.toArrayCopy(), 1e-12);
    }

    @Test
    void largestEntryOfEachEigenvectorIsPositive() {
        Decomposition d = solver.decompose(new double[][]{
                {2, 1},
                {1, 2}
        });
        double h = Math.sqrt(0.5);

        assertEquals(3.0, d.eigenvalue(0), 1e-12);
        assertEquals(1.0, d.eigenvalue(1), 1e-12);
        assertEquals(h, d.eigenvectors().get(0).get(0), 1e-12);
        assertEquals(h, d.eigenvectors().get(0).get(1), 1e-12);
        // tie on magnitude: the first entry decides
        assertEquals(h, d.eigenvectors().get(1).get(0), 1e-12);
        assertEquals(-h, d.eigenvectors().get(1).get(1), 1e-12);
    }

    @Test
    void numericalRankIgnoresRoundOff() {
        Decomposition d = solver.decompose(new double[][]{
                {1, 1},
                {1, 1}
        });
        assertEquals(1, d.numericalRank(1e-10));
        assertTrue(d.eigenvalue(1) >= 0.0);
    }

    @Test
    void rejectsNonSquareInput() {
        assertThrows(IllegalArgumentException.class, () -> solver.decompose(new double[][]{{1, 2}}));
    }
}
