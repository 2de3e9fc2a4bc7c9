package org.sensorflow.subspace;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.sensorflow.SyntheticMachine;
import org.sensorflow.error.DegenerateBaselineException;
import org.sensorflow.linalg.CommonsMathEigenSolver;
import org.sensorflow.linalg.Decomposition;
import org.sensorflow.model.SensorSample;
import org.sensorflow.model.Vector;
import org.sensorflow.preprocess.Preprocessor;
import org.sensorflow.preprocess.ScaleFit;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SubspaceFitterTest {

    private SubspaceFitter fitter;

    @BeforeEach
    void setUp() {
        fitter = new SubspaceFitter(new CommonsMathEigenSolver(), ComponentPolicy.DEFAULT);
    }

    private static List<Vector> standardizedBaseline(long seed, int rows) {
        List<Vector> raw = new SyntheticMachine(seed).normal(rows).stream().map(SensorSample::readings).toList();
        Preprocessor pre = new Preprocessor();
        ScaleFit fit = pre.fitScale(raw);
        List<Vector> out = new ArrayList<>();
        for (Vector r : raw) out.add(pre.standardize(r, fit));
        return out;
    }

    @Test
    void twoFactorMachineKeepsTwoOrthonormalComponents() {
        SubspaceModel model = fitter.fit(standardizedBaseline(7L, 400), 4);

        assertEquals(4, model.width());
        assertEquals(2, model.visualRank());
        assertEquals(2, model.reconstructionRank());
        assertTrue(model.explainedVarianceRatio(2) > 0.95);

        List<Vector> c = model.reconstructionComponents();
        assertEquals(1.0, c.get(0).norm(), 1e-9);
        assertEquals(1.0, c.get(1).norm(), 1e-9);
        assertEquals(0.0, c.get(0).dot(c.get(1)), 1e-9);

        double[] ev = model.eigenvalues();
        assertEquals(4.0, ev[0] + ev[1] + ev[2] + ev[3], 1e-9);
        for (int i = 1; i < ev.length; i++) assertTrue(ev[i] <= ev[i - 1]);
    }

    @Test
    void fitIsDeterministic() {
        assertEquals(fitter.fit(standardizedBaseline(11L, 200), 4), fitter.fit(standardizedBaseline(11L, 200), 4));
    }

    @Test
    void tooFewSamplesIsDegenerate() {
        DegenerateBaselineException ex = assertThrows(DegenerateBaselineException.class,
                () -> fitter.fit(standardizedBaseline(3L, 4), 4));
        assertEquals(5, ex.minimumSamples());
        assertEquals(4, ex.actualSamples());
    }

    @Test
    void rankBelowVisualComponentsIsDegenerate() {
        List<Vector> collinear = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            double t = i - 9.5;
            collinear.add(Vector.of(t, t, t));
        }
        assertThrows(DegenerateBaselineException.class, () -> fitter.fit(collinear, 3));
    }

    @Test
    void reconstructionRankFollowsVarianceTargetAndLeavesResidualRoom() {
        Decomposition d = new Decomposition(new double[]{5, 3, 1.5, 0.5}, List.of(
                Vector.of(1, 0, 0, 0), Vector.of(0, 1, 0, 0), Vector.of(0, 0, 1, 0), Vector.of(0, 0, 0, 1)));

        // 90% of 10 is reached after three components
        assertEquals(3, fitter.chooseReconstructionRank(d, 4, 4, 2));
        // never all active directions while a smaller rank still covers kVisual
        SubspaceFitter greedy = new SubspaceFitter(new CommonsMathEigenSolver(), new ComponentPolicy(2, 1.0));
        assertEquals(3, greedy.chooseReconstructionRank(d, 4, 4, 2));
        // never below kVisual
        SubspaceFitter loose = new SubspaceFitter(new CommonsMathEigenSolver(), new ComponentPolicy(2, 0.1));
        assertEquals(2, loose.chooseReconstructionRank(d, 4, 4, 2));
    }
}
