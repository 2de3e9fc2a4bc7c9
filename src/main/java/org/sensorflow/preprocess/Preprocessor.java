package org.sensorflow.preprocess;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.sensorflow.error.DimensionMismatchException;
import org.sensorflow.error.InvalidInputException;
import org.sensorflow.error.ModelNotFittedException;
import org.sensorflow.model.TrainedModel;
import org.sensorflow.model.Vector;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Standardizes raw readings against a learned mean and scale: z_i = (x_i - mean_i) / scale_i.
 *
 * Sensors whose baseline standard deviation is below {@code epsilon} are kept at scale 1 and
 * reported as constant, so callers can leave them out of residual statistics.
 */
public final class Preprocessor {

    private static final Logger logger = LogManager.getLogger(Preprocessor.class);

    public static final double DEFAULT_EPSILON = 1e-8;

    private final double epsilon;

    public Preprocessor() {
        this(DEFAULT_EPSILON);
    }

    public Preprocessor(double epsilon) {
        if (!(epsilon > 0.0) || !Double.isFinite(epsilon)) {
            throw new IllegalArgumentException("epsilon must be positive and finite");
        }
        this.epsilon = epsilon;
    }

    /**
     * Mean and population standard deviation of every sensor over the baseline.
     *
     * @throws InvalidInputException if the baseline is empty, ragged, or holds non-finite readings
     */
    public ScaleFit fitScale(List<Vector> baseline) {
        Objects.requireNonNull(baseline, "baseline must not be null");
        if (baseline.isEmpty()) {
            throw new InvalidInputException("Cannot fit scale on an empty baseline");
        }

        int width = baseline.get(0).dim();
        double[][] columns = new double[width][baseline.size()];
        for (int r = 0; r < baseline.size(); r++) {
            Vector row = baseline.get(r);
            DimensionMismatchException.check(width, row.dim());
            requireFinite(row, "baseline row " + r);
            for (int c = 0; c < width; c++) {
                columns[c][r] = row.get(c);
            }
        }

        Mean meanStat = new Mean();
        StandardDeviation stdStat = new StandardDeviation(false);
        double[] mean = new double[width];
        double[] scale = new double[width];
        Set<Integer> constant = new TreeSet<>();

        for (int c = 0; c < width; c++) {
            mean[c] = meanStat.evaluate(columns[c]);
            double std = stdStat.evaluate(columns[c]);
            if (std < epsilon) {
                scale[c] = 1.0;
                constant.add(c);
            } else {
                scale[c] = std;
            }
        }

        if (!constant.isEmpty()) {
            logger.debug("Constant sensors excluded from residual statistics: {}", constant);
        }
        return new ScaleFit(new Vector(mean), new Vector(scale), constant);
    }

    public Vector standardize(Vector sample, ScaleFit fit) {
        Objects.requireNonNull(fit, "fit must not be null");
        return standardize(sample, fit.mean(), fit.scale());
    }

    /**
     * @throws ModelNotFittedException   if {@code model} is null
     * @throws DimensionMismatchException if the sample width differs from the model width
     * @throws InvalidInputException      if the sample holds NaN or infinite readings
     */
    public Vector standardize(Vector sample, TrainedModel model) {
        if (model == null) {
            throw new ModelNotFittedException();
        }
        return standardize(sample, model.mean(), model.scale());
    }

    /**
     * Inverse of {@link #standardize(Vector, TrainedModel)}: x_i = z_i * scale_i + mean_i.
     */
    public Vector destandardize(Vector standardized, TrainedModel model) {
        if (model == null) {
            throw new ModelNotFittedException();
        }
        Objects.requireNonNull(standardized, "standardized must not be null");
        DimensionMismatchException.check(model.width(), standardized.dim());
        return standardized.multiply(model.scale()).add(model.mean());
    }

    /**
     * Zeroes constant sensors so they contribute nothing to projections or residuals.
     */
    public static Vector activeOnly(Vector standardized, Set<Integer> constantSensors) {
        return standardized.withZeroed(constantSensors);
    }

    private static Vector standardize(Vector sample, Vector mean, Vector scale) {
        Objects.requireNonNull(sample, "sample must not be null");
        DimensionMismatchException.check(mean.dim(), sample.dim());
        requireFinite(sample, "sample");
        return sample.subtract(mean).divide(scale);
    }

    private static void requireFinite(Vector v, String what) {
        int bad = v.firstNonFiniteIndex();
        if (bad >= 0) {
            throw new InvalidInputException(what + " has a non-finite reading at sensor index " + bad + ": " + v.get(bad));
        }
    }
}
