// file: src/main/java/io/symtree/mesh/Chebyshev1DSubMesh.java
package io.symtree.mesh;

import io.symtree.core.CoordinateSystem;
import io.symtree.core.SpatialVariable;

import java.util.Map;

/**
 * 1D sub-mesh whose interior edges are Chebyshev nodes on (a, b):
 * <pre>
 *   x_k = (a+b)/2 + (b-a)/2 * cos((2k-1) * pi / (2N)),   k = 1..N
 * </pre>
 * With N = npts - 1 interior edges plus both boundaries, the mesh has
 * npts + 1 edges and npts nodes. Points cluster towards the boundaries.
 */
public final class Chebyshev1DSubMesh extends SubMesh1D {

    private Chebyshev1DSubMesh(double[] edges, CoordinateSystem coordSys) {
        super(edges, coordSys);
    }

    public static Chebyshev1DSubMesh create(Map<SpatialVariable, Interval> lims, VarPts npts) {
        var entry = single(lims);
        SpatialVariable var = entry.getKey();
        int n = npts.pointsFor(var);
        if (n < 2) {
            throw new GeometryException("Chebyshev sub-mesh for %s needs at least 2 points, got %d".formatted(var, n));
        }
        return new Chebyshev1DSubMesh(chebyshevEdges(entry.getValue(), n - 1), var.coordSys());
    }

    /**
     * {@code [a, x_N, ..., x_1, b]}: the N Chebyshev nodes in ascending order
     * between the two boundaries.
     */
    static double[] chebyshevEdges(Interval range, int interior) {
        double a = range.min();
        double b = range.max();
        double[] edges = new double[interior + 2];
        edges[0] = a;
        for (int i = 0; i < interior; i++) {
            int k = interior - i; // x_k decreases with k
            edges[i + 1] = (a + b) / 2 + (b - a) / 2 * Math.cos((2.0 * k - 1) * Math.PI / (2.0 * interior));
        }
        edges[interior + 1] = b;
        return edges;
    }
}
