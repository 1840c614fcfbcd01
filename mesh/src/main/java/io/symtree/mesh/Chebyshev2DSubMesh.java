// file: src/main/java/io/symtree/mesh/Chebyshev2DSubMesh.java
package io.symtree.mesh;

import io.symtree.core.CoordinateSystem;
import io.symtree.core.SpatialVariable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tensor-product grid over the current collector plane (variables y and z).
 * Along each axis the edges are npts - 2 Chebyshev nodes plus both
 * boundaries, so each axis has exactly npts edges.
 * <p>
 * Only the per-axis edges are produced; no triangulation is built.
 */
public final class Chebyshev2DSubMesh implements SubMesh {

    private static final Set<String> ALLOWED = Set.of("y", "z");

    private final Map<String, double[]> edges;
    private final CoordinateSystem coordSys;

    private Chebyshev2DSubMesh(Map<String, double[]> edges, CoordinateSystem coordSys) {
        this.edges = Collections.unmodifiableMap(edges);
        this.coordSys = coordSys;
    }

    /**
     * @throws GeometryException unless exactly two variables are given, or if a
     *                           variable has fewer than 3 points
     * @throws DomainException   if the variables use different coordinate systems
     *                           or are not named y and z
     */
    public static Chebyshev2DSubMesh create(Map<SpatialVariable, Interval> lims, VarPts npts) {
        if (lims.size() != 2) {
            throw new GeometryException("lims should contain exactly two variables, not " + lims.size());
        }
        List<SpatialVariable> vars = List.copyOf(lims.keySet());
        CoordinateSystem first = vars.get(0).coordSys();
        CoordinateSystem second = vars.get(1).coordSys();
        if (first != second) {
            throw new DomainException("spatial variables should have the same coordinate system, but have %s and %s"
                    .formatted(first, second));
        }

        var out = new LinkedHashMap<String, double[]>();
        for (SpatialVariable var : vars) {
            if (!ALLOWED.contains(var.name())) {
                throw new DomainException("spatial variable must be y or z not " + var.name());
            }
            int n = npts.pointsFor(var);
            if (n < 3) {
                throw new GeometryException("Chebyshev 2D sub-mesh for %s needs at least 3 points, got %d"
                        .formatted(var, n));
            }
            out.put(var.name(), Chebyshev1DSubMesh.chebyshevEdges(lims.get(var), n - 2));
        }
        return new Chebyshev2DSubMesh(out, first);
    }

    public Set<String> variables() {
        return edges.keySet();
    }

    /**
     * @throws DomainException if {@code variable} is not an axis of this mesh
     */
    public double[] edges(String variable) {
        double[] e = edges.get(variable);
        if (e == null) throw new DomainException("no axis named " + variable);
        return e.clone();
    }

    /** Number of grid points along {@code variable}. */
    public int npts(String variable) {
        return edges(variable).length;
    }

    @Override
    public CoordinateSystem coordSys() {
        return coordSys;
    }
}
