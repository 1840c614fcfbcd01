// file: src/test/java/io/symtree/mesh/MeshTest.java
package io.symtree.mesh;

import io.symtree.core.CoordinateSystem;
import io.symtree.core.Parameter;
import io.symtree.core.Scalar;
import io.symtree.core.SpatialVariable;
import io.symtree.core.Time;
import io.symtree.core.TreeSettings;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * A mesh validates every domain, evaluates the limits and builds one sub-mesh per domain.
 */
class MeshTest {

    private static final SpatialVariable X_N = new SpatialVariable("x_n", List.of("negative electrode"));
    private static final SpatialVariable X_S = new SpatialVariable("x_s", List.of("separator"));

    private static Geometry twoDomains() {
        return Geometry.builder()
                .add("negative electrode", X_N, Limits.of(0, 0.4))
                .add("separator", X_S, Limits.of(0.4, 0.6))
                .build();
    }

    @Test
    void builds_one_sub_mesh_per_domain_in_order() {
        var mesh = new Mesh(twoDomains(),
                Map.of("negative electrode", SubMeshType.UNIFORM, "separator", SubMeshType.CHEBYSHEV),
                VarPts.of(Map.of(X_N, 10, X_S, 5)));

        assertEquals(List.of("negative electrode", "separator"), List.copyOf(mesh.domains()));
        assertInstanceOf(Uniform1DSubMesh.class, mesh.get("negative electrode"));
        assertInstanceOf(Chebyshev1DSubMesh.class, mesh.get("separator"));
        assertEquals(5, ((SubMesh1D) mesh.get("separator")).npts());
        assertThrows(DomainException.class, () -> mesh.get("positive electrode"));
    }

    @Test
    void point_counts_are_found_through_structurally_equal_variables() {
        // a copy taken from a tree has a different reference but the same id
        var copy = X_N.multiply(new Scalar(2)).left();
        assertNotSame(X_N, copy);

        var varPts = VarPts.of(Map.of((SpatialVariable) copy, 7));
        var geometry = Geometry.builder().add("negative electrode", X_N, Limits.of(0, 1)).build();
        var mesh = new Mesh(geometry, Map.of("negative electrode", SubMeshType.UNIFORM), varPts);

        assertEquals(7, ((SubMesh1D) mesh.get("negative electrode")).npts());
    }

    @Test
    void missing_sub_mesh_type_is_rejected() {
        assertThrows(GeometryException.class, () -> new Mesh(twoDomains(),
                Map.of("negative electrode", SubMeshType.UNIFORM),
                VarPts.of(Map.of(X_N, 10, X_S, 5))));
    }

    @Test
    void missing_point_count_is_rejected() {
        var ex = assertThrows(GeometryException.class, () -> new Mesh(twoDomains(),
                Map.of("negative electrode", SubMeshType.UNIFORM, "separator", SubMeshType.UNIFORM),
                VarPts.of(Map.of(X_N, 10))));
        assertTrue(ex.getMessage().contains("x_s"));
    }

    @Test
    void limit_expressions_are_evaluated() {
        var geometry = Geometry.builder()
                .add("negative electrode", X_N, new Limits(new Scalar(0), new Scalar(0.1).add(new Scalar(0.3))))
                .build();
        var mesh = new Mesh(geometry, Map.of("negative electrode", SubMeshType.UNIFORM), VarPts.of(Map.of(X_N, 4)));

        double[] edges = ((SubMesh1D) mesh.get("negative electrode")).edges();
        assertEquals(0.4, edges[edges.length - 1], 1e-12);
    }

    @Test
    void unevaluable_limits_are_reported_as_geometry_errors() {
        var geometry = Geometry.builder()
                .add("negative electrode", X_N, new Limits(new Scalar(0), new Parameter("L_n")))
                .build();
        var ex = assertThrows(GeometryException.class, () -> new Mesh(geometry,
                Map.of("negative electrode", SubMeshType.UNIFORM), VarPts.of(Map.of(X_N, 4))));
        assertNotNull(ex.getCause());
    }

    @Test
    void limits_depending_on_time_are_reported_as_geometry_errors() {
        var geometry = Geometry.builder()
                .add("negative electrode", X_N, new Limits(new Scalar(0), new Time()))
                .build();
        var ex = assertThrows(GeometryException.class, () -> new Mesh(geometry,
                Map.of("negative electrode", SubMeshType.UNIFORM), VarPts.of(Map.of(X_N, 4))));
        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
    }

    @Test
    void non_finite_limits_in_debug_mode_are_reported_as_geometry_errors() {
        var geometry = Geometry.builder()
                .add("negative electrode", X_N, new Limits(new Scalar(0), new Scalar(1).divide(new Scalar(0))))
                .build();
        var ex = assertThrows(GeometryException.class, () -> new Mesh(geometry,
                Map.of("negative electrode", SubMeshType.UNIFORM), VarPts.of(Map.of(X_N, 4)),
                TreeSettings.defaults().withDebugMode(true)));
        assertInstanceOf(ArithmeticException.class, ex.getCause());
    }

    @Test
    void point_counts_too_large_for_an_array_are_rejected() {
        assertThrows(GeometryException.class, () -> VarPts.of(Map.of(X_N, Integer.MAX_VALUE)));
        assertEquals(VarPts.MAX_POINTS, VarPts.of(Map.of(X_N, VarPts.MAX_POINTS)).pointsFor(X_N));
    }

    @Test
    void conflicting_point_counts_are_rejected() {
        var a = new SpatialVariable("x", List.of("a"), CoordinateSystem.CARTESIAN);
        var b = new SpatialVariable("x", List.of("b"), CoordinateSystem.CARTESIAN);
        assertThrows(GeometryException.class, () -> VarPts.of(Map.of(a, 3, b, 4)));
        assertThrows(GeometryException.class, () -> VarPts.of(Map.of(a, 0)));
    }

    @Test
    void duplicate_variable_in_domain_is_rejected() {
        var builder = Geometry.builder().add("separator", X_S, Limits.of(0, 1));
        assertThrows(GeometryException.class, () -> builder.add("separator", X_S, Limits.of(0, 2)));
        assertThrows(GeometryException.class, () -> Geometry.builder().build());
    }
}
