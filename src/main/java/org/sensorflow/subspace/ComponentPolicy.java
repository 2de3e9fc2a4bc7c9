package org.sensorflow.subspace;

/**
 * How many components to keep for each use of the decomposition.
 *
 * @param visualComponents components behind the 2D coordinate (normally 2)
 * @param varianceFraction cumulative explained-variance target in (0, 1] for the reconstruction rank
 */
public record ComponentPolicy(int visualComponents, double varianceFraction) {

    public static final ComponentPolicy DEFAULT = new ComponentPolicy(2, 0.90);

    public ComponentPolicy {
        if (visualComponents < 1) {
            throw new IllegalArgumentException("visualComponents must be >= 1");
        }
        if (!(varianceFraction > 0.0 && varianceFraction <= 1.0)) {
            throw new IllegalArgumentException("varianceFraction must be in (0, 1], got " + varianceFraction);
        }
    }
}
