package org.sensorflow.scoring;

import org.sensorflow.model.Vector;
import org.sensorflow.projection.ProjectionEngine;
import org.sensorflow.subspace.SubspaceModel;

import java.util.List;
import java.util.Objects;

/**
 * Computes both deviation statistics from a single projection:
 * - reconstruction error: what the normal subspace cannot explain
 * - subspace distance: how unusual the explained part is, in units of baseline variance
 */
public final class ResidualScorer {

    private final ProjectionEngine projection;

    public ResidualScorer(ProjectionEngine projection) {
        this.projection = Objects.requireNonNull(projection, "projection must not be null");
    }

    /**
     * @param standardized standardized sample with constant sensors already zeroed
     */
    public ResidualStatistics score(Vector standardized, SubspaceModel subspace) {
        Objects.requireNonNull(standardized, "standardized must not be null");
        Objects.requireNonNull(subspace, "subspace must not be null");

        List<Vector> components = subspace.reconstructionComponents();
        Vector scores = projection.project(standardized, components);
        Vector residual = standardized.subtract(projection.reconstruct(scores, components));

        double t2 = 0.0;
        for (int i = 0; i < scores.dim(); i++) {
            double s = scores.get(i);
            t2 += (s * s) / subspace.eigenvalue(i);
        }

        return new ResidualStatistics(residual.normSquared(), t2, scores, residual);
    }
}
