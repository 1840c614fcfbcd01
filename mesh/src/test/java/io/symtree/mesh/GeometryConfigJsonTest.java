// file: src/test/java/io/symtree/mesh/GeometryConfigJsonTest.java
package io.symtree.mesh;

import io.symtree.core.CoordinateSystem;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Geometry, sub-mesh types and point counts can be loaded from JSON.
 */
class GeometryConfigJsonTest {

    @TempDir
    Path tmp;

    @Test
    void loads_particle_and_current_collector_domains() throws Exception {
        String json = """
                {
                  "domains": [
                    {
                      "name": "negative particle",
                      "submesh": "chebyshev",
                      "variables": [
                        {"name": "r", "coordSys": "spherical polar", "min": 0, "max": 1, "points": 20}
                      ]
                    },
                    {
                      "name": "current collector",
                      "submesh": "chebyshev2d",
                      "variables": [
                        {"name": "y", "min": 0, "max": 1, "points": 6},
                        {"name": "z", "min": 0, "max": 2, "points": 7}
                      ]
                    }
                  ]
                }
                """;
        Path file = tmp.resolve("geometry.json");
        Files.writeString(file, json);

        var cfg = GeometryConfig.fromJsonFile(file);
        var r = cfg.variable("negative particle", "r");
        assertEquals(CoordinateSystem.SPHERICAL_POLAR, r.coordSys());
        assertEquals(20, cfg.varPts().pointsFor(r));
        assertEquals(SubMeshType.CHEBYSHEV_2D, cfg.submeshTypes().get("current collector"));

        var mesh = cfg.toMesh();
        var particle = (SubMesh1D) mesh.get("negative particle");
        assertEquals(20, particle.npts());
        var collector = (Chebyshev2DSubMesh) mesh.get("current collector");
        assertEquals(6, collector.npts("y"));
        assertEquals(7, collector.npts("z"));
    }

    @Test
    void unknown_sub_mesh_type_is_rejected() throws Exception {
        Path file = tmp.resolve("bad.json");
        Files.writeString(file, """
                {"domains": [{"name": "separator", "submesh": "hexagonal",
                  "variables": [{"name": "x", "min": 0, "max": 1, "points": 3}]}]}
                """);
        assertThrows(IllegalArgumentException.class, () -> GeometryConfig.fromJsonFile(file));
    }

    @Test
    void empty_geometry_is_rejected() throws Exception {
        Path file = tmp.resolve("empty.json");
        Files.writeString(file, "{\"domains\": []}");
        assertThrows(GeometryException.class, () -> GeometryConfig.fromJsonFile(file));
    }

    @Test
    void unreadable_file_is_wrapped() {
        var ex = assertThrows(UncheckedIOException.class, () -> GeometryConfig.fromJsonFile(tmp.resolve("missing.json")));
        assertTrue(ex.getMessage().contains("missing.json"));
    }
}
