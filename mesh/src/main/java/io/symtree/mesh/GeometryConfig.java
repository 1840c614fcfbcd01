// file: src/main/java/io/symtree/mesh/GeometryConfig.java
package io.symtree.mesh;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.symtree.core.CoordinateSystem;
import io.symtree.core.SpatialVariable;
import io.symtree.mesh.dto.DomainJson;
import io.symtree.mesh.dto.GeometryJson;
import io.symtree.mesh.dto.VariableJson;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Everything needed to build a {@link Mesh}, usually loaded from JSON:
 * <pre>
 * {
 *   "domains": [
 *     {
 *       "name": "negative particle",
 *       "submesh": "chebyshev",
 *       "variables": [
 *         {"name": "r", "coordSys": "spherical polar", "min": 0, "max": 1, "points": 20}
 *       ]
 *     }
 *   ]
 * }
 * </pre>
 * Each variable becomes a {@link SpatialVariable} on its domain, with scalar limits.
 */
public record GeometryConfig(
        Geometry geometry,
        Map<String, SubMeshType> submeshTypes,
        VarPts varPts
) {
    private static final Logger log = Logger.getLogger(GeometryConfig.class.getName());

    public GeometryConfig {
        Objects.requireNonNull(geometry, "geometry");
        Objects.requireNonNull(varPts, "varPts");
        submeshTypes = Map.copyOf(submeshTypes);
    }

    public static GeometryConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            GeometryJson json = mapper.readValue(path.toFile(), GeometryJson.class);
            GeometryConfig cfg = fromJson(json);
            log.log(Level.INFO, "Loaded geometry from {0} with {1} domain(s)",
                    new Object[] { path, cfg.geometry().domains().size() });
            return cfg;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load GeometryConfig from " + path, e);
        }
    }

    static GeometryConfig fromJson(GeometryJson json) {
        if (json.domains == null || json.domains.isEmpty()) {
            throw new GeometryException("geometry must contain at least one domain");
        }
        var geometry = Geometry.builder();
        var types = new LinkedHashMap<String, SubMeshType>();
        var points = new LinkedHashMap<SpatialVariable, Integer>();

        for (DomainJson d : json.domains) {
            if (d.name == null || d.name.isBlank()) throw new GeometryException("domain name must not be blank");
            if (d.variables == null || d.variables.isEmpty()) {
                throw new GeometryException("domain %s has no variables".formatted(d.name));
            }
            types.put(d.name, SubMeshType.fromLabel(d.submesh));
            for (VariableJson v : d.variables) {
                if (v.name == null || v.name.isBlank()) {
                    throw new GeometryException("variable name must not be blank in domain " + d.name);
                }
                var var = new SpatialVariable(v.name, List.of(d.name), CoordinateSystem.fromLabel(v.coordSys));
                geometry.add(d.name, var, Limits.of(v.min, v.max));
                points.put(var, v.points);
            }
        }
        return new GeometryConfig(geometry.build(), types, VarPts.of(points));
    }

    public Mesh toMesh() {
        return new Mesh(geometry, submeshTypes, varPts);
    }

    /**
     * Spatial variable {@code name} of {@code domain}.
     *
     * @throws DomainException if there is no such variable
     */
    public SpatialVariable variable(String domain, String name) {
        return geometry.variables(domain).keySet().stream()
                .filter(v -> v.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new DomainException("no variable %s in domain %s".formatted(name, domain)));
    }
}
