package org.sensorflow.projection;

import org.junit.jupiter.api.Test;
import org.sensorflow.error.DimensionMismatchException;
import org.sensorflow.model.Vector;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProjectionEngineTest {

    private final ProjectionEngine engine = new ProjectionEngine();
    private final List<Vector> plane = List.of(Vector.of(1, 0, 0), Vector.of(0, 1, 0));

    @Test
    void projectsOntoEachComponent() {
        assertEquals(Vector.of(2, 3), engine.project(Vector.of(2, 3, 4), plane));
    }

    @Test
    void residualIsOrthogonalPart() {
        Vector v = Vector.of(2, 3, 4);
        Vector residual = engine.residual(v, plane);

        assertEquals(Vector.of(0, 0, 4), residual);
        assertEquals(v, engine.reconstruct(engine.project(v, plane), plane).add(residual));
    }

    @Test
    void rejectsWidthMismatch() {
        assertThrows(DimensionMismatchException.class, () -> engine.project(Vector.of(1, 2), plane));
        assertThrows(DimensionMismatchException.class, () -> engine.reconstruct(Vector.of(1, 2, 3), plane));
        assertThrows(IllegalArgumentException.class, () -> engine.project(Vector.of(1, 2, 3), List.of()));
    }
}
