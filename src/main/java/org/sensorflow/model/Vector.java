package org.sensorflow.model;

import org.sensorflow.error.DimensionMismatchException;

import java.util.Arrays;
import java.util.Collection;
import java.util.Set;

/**
 * An immutable, fixed-length vector of doubles.
 *
 * Used for raw readings, standardized readings, principal components and projection scores.
 * Binary operations require equal width and fail with {@link DimensionMismatchException} otherwise.
 */
public final class Vector {

    private final double[] data;

    /**
     * Constructs a Vector from the given array.
     * The input array is copied to keep immutability.
     *
     * @param values raw values (must be non-null and non-empty)
     */
    public Vector(double[] values) {
        if (values == null) {
            throw new IllegalArgumentException("values must not be null");
        }
        if (values.length == 0) {
            throw new IllegalArgumentException("values must not be empty");
        }
        this.data = Arrays.copyOf(values, values.length);
    }

    public static Vector of(double... values) {
        return new Vector(values);
    }

    public static Vector zeros(int dim) {
        if (dim <= 0) {
            throw new IllegalArgumentException("dim must be >= 1");
        }
        return new Vector(new double[dim]);
    }

    /**
     * @return the vector dimension (number of components).
     */
    public int dim() {
        return data.length;
    }

    /**
     * Returns a defensive copy of the internal data.
     */
    public double[] toArrayCopy() {
        return Arrays.copyOf(data, data.length);
    }

    /**
     * Returns the value at the given component index.
     *
     * @throws IndexOutOfBoundsException if the index is invalid
     */
    public double get(int index) {
        if (index < 0 || index >= data.length) {
            throw new IndexOutOfBoundsException("index=" + index + ", dim=" + data.length);
        }
        return data[index];
    }

    public double dot(Vector other) {
        requireSameDim(other);
        double sum = 0.0;
        for (int i = 0; i < data.length; i++) {
            sum += this.data[i] * other.data[i];
        }
        return sum;
    }

    /**
     * Computes the L2 norm (Euclidean length).
     */
    public double norm() {
        return Math.sqrt(normSquared());
    }

    /**
     * Returns the squared L2 norm of the vector (||v||^2).
     * This is the reconstruction error when called on a residual.
     */
    public double normSquared() {
        double sumSq = 0.0;
        for (double v : data) {
            sumSq += v * v;
        }
        return sumSq;
    }

    public Vector add(Vector other) {
        requireSameDim(other);
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = this.data[i] + other.data[i];
        }
        return new Vector(out);
    }

    public Vector subtract(Vector other) {
        requireSameDim(other);
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = this.data[i] - other.data[i];
        }
        return new Vector(out);
    }

    /**
     * Scales this vector by a constant factor.
     */
    public Vector scale(double alpha) {
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = alpha * this.data[i];
        }
        return new Vector(out);
    }

    /**
     * Component-wise product (this[i] * other[i]).
     */
    public Vector multiply(Vector other) {
        requireSameDim(other);
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = this.data[i] * other.data[i];
        }
        return new Vector(out);
    }

    /**
     * Component-wise quotient (this[i] / other[i]). The caller guarantees non-zero divisors.
     */
    public Vector divide(Vector other) {
        requireSameDim(other);
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = this.data[i] / other.data[i];
        }
        return new Vector(out);
    }

    /**
     * Returns a copy with the given component indices set to zero.
     */
    public Vector withZeroed(Set<Integer> indices) {
        if (indices == null || indices.isEmpty()) {
            return this;
        }
        double[] out = Arrays.copyOf(data, data.length);
        for (int idx : indices) {
            if (idx < 0 || idx >= out.length) {
                throw new IndexOutOfBoundsException("index=" + idx + ", dim=" + out.length);
            }
            out[idx] = 0.0;
        }
        return new Vector(out);
    }

    /**
     * @return index of the first NaN or infinite component, or -1 if every component is finite
     */
    public int firstNonFiniteIndex() {
        for (int i = 0; i < data.length; i++) {
            if (!Double.isFinite(data[i])) {
                return i;
            }
        }
        return -1;
    }

    public boolean isFinite() {
        return firstNonFiniteIndex() < 0;
    }

    public static Vector average(Collection<Vector> vectors) {
        if (vectors == null || vectors.isEmpty()) {
            throw new IllegalArgumentException("Cannot average empty vectors");
        }

        int dim = vectors.iterator().next().dim();
        double[] sum = new double[dim];

        for (Vector v : vectors) {
            DimensionMismatchException.check(dim, v.dim());
            for (int i = 0; i < dim; i++) sum[i] += v.data[i];
        }

        int n = vectors.size();
        for (int i = 0; i < dim; i++) {
            sum[i] /= n;
        }

        return new Vector(sum);
    }

    private void requireSameDim(Vector other) {
        if (other == null) {
            throw new IllegalArgumentException("other must not be null");
        }
        DimensionMismatchException.check(this.data.length, other.data.length);
    }

    @Override
    public String toString() {
        // Short summary: a machine row can hold dozens of sensors
        return "Vector(dim=" + data.length + ")";
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null) return false;
        if (obj.getClass() != this.getClass()) return false;

        Vector other = (Vector) obj;
        return Arrays.equals(this.data, other.data);
    }
}
