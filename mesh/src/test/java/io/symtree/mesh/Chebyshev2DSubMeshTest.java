// file: src/test/java/io/symtree/mesh/Chebyshev2DSubMeshTest.java
package io.symtree.mesh;

import io.symtree.core.CoordinateSystem;
import io.symtree.core.SpatialVariable;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 2D Chebyshev sub-meshes need exactly two y/z variables sharing a coordinate system.
 */
class Chebyshev2DSubMeshTest {

    private static final List<String> CC = List.of("current collector");

    private static Map<SpatialVariable, Interval> lims(SpatialVariable a, SpatialVariable b) {
        var lims = new LinkedHashMap<SpatialVariable, Interval>();
        lims.put(a, new Interval(0, 1));
        lims.put(b, new Interval(0, 2));
        return lims;
    }

    @Test
    void builds_edges_per_axis() {
        var y = new SpatialVariable("y", CC);
        var z = new SpatialVariable("z", CC);
        var sub = Chebyshev2DSubMesh.create(lims(y, z), VarPts.of(Map.of(y, 6, z, 5)));

        assertEquals(List.of("y", "z"), List.copyOf(sub.variables()));
        assertEquals(6, sub.npts("y"));
        assertEquals(5, sub.npts("z"));
        double[] ez = sub.edges("z");
        assertEquals(0.0, ez[0]);
        assertEquals(2.0, ez[ez.length - 1]);
        assertEquals(CoordinateSystem.CARTESIAN, sub.coordSys());
        assertThrows(DomainException.class, () -> sub.edges("x"));
    }

    @Test
    void requires_exactly_two_variables() {
        var y = new SpatialVariable("y", CC);
        assertThrows(GeometryException.class,
                () -> Chebyshev2DSubMesh.create(Map.of(y, new Interval(0, 1)), VarPts.of(Map.of(y, 5))));
    }

    @Test
    void requires_same_coordinate_system() {
        var y = new SpatialVariable("y", CC, CoordinateSystem.CARTESIAN);
        var z = new SpatialVariable("z", CC, CoordinateSystem.CYLINDRICAL_POLAR);
        var ex = assertThrows(DomainException.class,
                () -> Chebyshev2DSubMesh.create(lims(y, z), VarPts.of(Map.of(y, 5, z, 5))));
        assertTrue(ex.getMessage().contains("cylindrical polar"));
    }

    @Test
    void requires_y_and_z() {
        var x = new SpatialVariable("x", CC);
        var z = new SpatialVariable("z", CC);
        var ex = assertThrows(DomainException.class,
                () -> Chebyshev2DSubMesh.create(lims(x, z), VarPts.of(Map.of(x, 5, z, 5))));
        assertTrue(ex.getMessage().contains("y or z"));
    }

    @Test
    void too_few_points_are_rejected() {
        var y = new SpatialVariable("y", CC);
        var z = new SpatialVariable("z", CC);
        assertThrows(GeometryException.class,
                () -> Chebyshev2DSubMesh.create(lims(y, z), VarPts.of(Map.of(y, 2, z, 5))));
    }
}
