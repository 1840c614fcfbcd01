// file: src/main/java/io/symtree/mesh/Mesh.java
package io.symtree.mesh;

import io.symtree.core.EvaluationNotImplementedException;
import io.symtree.core.Evaluator;
import io.symtree.core.SpatialVariable;
import io.symtree.core.TreeSettings;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One sub-mesh per geometry domain.
 * <p>
 * Construction:
 *  - every domain needs a sub-mesh factory and every variable a point count;
 *    both are checked for all domains before any sub-mesh is built,
 *  - limit expressions are evaluated (no t, no y) into intervals; any failure
 *    there, including a non-finite value in debug mode, is a GeometryException,
 *  - each domain's factory builds its sub-mesh.
 * The spatial variables and limit expressions are only read.
 */
public final class Mesh {
    private static final Logger log = Logger.getLogger(Mesh.class.getName());

    private final Map<String, SubMesh> submeshes;

    public Mesh(Geometry geometry, Map<String, ? extends SubMeshFactory> submeshTypes, VarPts varPts) {
        this(geometry, submeshTypes, varPts, TreeSettings.defaults());
    }

    public Mesh(
            Geometry geometry,
            Map<String, ? extends SubMeshFactory> submeshTypes,
            VarPts varPts,
            TreeSettings settings
    ) {
        Objects.requireNonNull(geometry, "geometry");
        Objects.requireNonNull(submeshTypes, "submeshTypes");
        Objects.requireNonNull(varPts, "varPts");

        for (String domain : geometry.domains()) {
            if (!submeshTypes.containsKey(domain)) {
                throw new GeometryException("no sub-mesh type given for domain " + domain);
            }
            for (SpatialVariable var : geometry.variables(domain).keySet()) {
                if (!varPts.contains(var)) {
                    throw new GeometryException("no number of points given for %s in domain %s".formatted(var, domain));
                }
            }
        }

        var evaluator = new Evaluator(settings);
        var built = new LinkedHashMap<String, SubMesh>();
        for (String domain : geometry.domains()) {
            var lims = new LinkedHashMap<SpatialVariable, Interval>();
            geometry.variables(domain).forEach((var, limits) -> lims.put(var, evaluate(domain, var, limits, evaluator)));

            SubMesh submesh = submeshTypes.get(domain).create(lims, varPts);
            built.put(domain, submesh);
            log.log(Level.FINE, () -> "Built %s for domain '%s' over %s"
                    .formatted(submesh.getClass().getSimpleName(), domain, lims.keySet()));
        }
        this.submeshes = Collections.unmodifiableMap(built);
    }

    /**
     * @throws DomainException if the mesh has no such domain
     */
    public SubMesh get(String domain) {
        SubMesh s = submeshes.get(domain);
        if (s == null) throw new DomainException("unknown domain: " + domain);
        return s;
    }

    public Set<String> domains() {
        return submeshes.keySet();
    }

    public int size() {
        return submeshes.size();
    }

    private static Interval evaluate(String domain, SpatialVariable var, Limits limits, Evaluator evaluator) {
        try {
            return limits.evaluate(evaluator);
        } catch (GeometryException e) {
            throw e;
        } catch (EvaluationNotImplementedException | IllegalStateException
                 | IllegalArgumentException | ArithmeticException e) {
            throw new GeometryException("limits of %s in domain %s cannot be evaluated to numbers"
                    .formatted(var, domain), e);
        }
    }
}
