// file: src/test/java/io/symtree/mesh/Uniform1DSubMeshTest.java
package io.symtree.mesh;

import io.symtree.core.SpatialVariable;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Uniform sub-meshes split the interval into equal cells.
 */
class Uniform1DSubMeshTest {

    private static final SpatialVariable X = new SpatialVariable("x", List.of("separator"));

    @Test
    void equally_spaced_edges_and_midpoint_nodes() {
        var sub = Uniform1DSubMesh.create(Map.of(X, new Interval(0, 1)), VarPts.of(Map.of(X, 4)));

        assertArrayEquals(new double[] {0, 0.25, 0.5, 0.75, 1}, sub.edges(), 1e-12);
        assertArrayEquals(new double[] {0.125, 0.375, 0.625, 0.875}, sub.nodes(), 1e-12);
        assertArrayEquals(new double[] {0.25, 0.25, 0.25, 0.25}, sub.dEdges(), 1e-12);
        assertEquals(3, sub.dNodes().length);
        assertEquals(4, sub.npts());
    }

    @Test
    void returned_arrays_are_copies() {
        var sub = Uniform1DSubMesh.create(Map.of(X, new Interval(0, 1)), VarPts.of(Map.of(X, 2)));
        sub.edges()[0] = 42;
        assertEquals(0.0, sub.edges()[0]);
    }

    @Test
    void bad_limits_are_rejected_before_building() {
        assertThrows(GeometryException.class, () -> new Interval(1, 1));
        assertThrows(GeometryException.class, () -> new Interval(2, 1));
        assertThrows(GeometryException.class, () -> new Interval(0, Double.NaN));
    }
}
