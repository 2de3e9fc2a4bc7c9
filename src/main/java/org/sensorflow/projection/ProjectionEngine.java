package org.sensorflow.projection;

import org.sensorflow.error.DimensionMismatchException;
import org.sensorflow.model.Vector;

import java.util.List;
import java.util.Objects;

/**
 * Maps standardized vectors into a learned subspace and back.
 *
 * For orthonormal components c_1..c_k and a vector v:
 *   score_i        = v · c_i
 *   reconstruction = sum_i score_i * c_i
 *   residual       = v - reconstruction   (the part of v outside the subspace)
 *
 * Stateless and deterministic; only dimensions are checked.
 */
public final class ProjectionEngine {

    /**
     * Inner product of the vector with each component.
     *
     * @return scores, one per component, in component order
     */
    public Vector project(Vector standardized, List<Vector> components) {
        Objects.requireNonNull(standardized, "standardized must not be null");
        requireComponents(components, standardized.dim());

        double[] scores = new double[components.size()];
        for (int i = 0; i < scores.length; i++) {
            scores[i] = standardized.dot(components.get(i));
        }
        return new Vector(scores);
    }

    /**
     * Linear combination of the components weighted by the scores.
     */
    public Vector reconstruct(Vector scores, List<Vector> components) {
        Objects.requireNonNull(scores, "scores must not be null");
        if (components == null || components.isEmpty()) {
            throw new IllegalArgumentException("components must not be null or empty");
        }
        DimensionMismatchException.check(components.size(), scores.dim());

        int width = components.get(0).dim();
        Vector out = Vector.zeros(width);
        for (int i = 0; i < components.size(); i++) {
            out = out.add(components.get(i).scale(scores.get(i)));
        }
        return out;
    }

    /**
     * The component of the vector orthogonal to the subspace spanned by the components.
     */
    public Vector residual(Vector standardized, List<Vector> components) {
        Vector scores = project(standardized, components);
        return standardized.subtract(reconstruct(scores, components));
    }

    private static void requireComponents(List<Vector> components, int width) {
        if (components == null || components.isEmpty()) {
            throw new IllegalArgumentException("components must not be null or empty");
        }
        for (Vector c : components) {
            DimensionMismatchException.check(width, c.dim());
        }
    }
}
