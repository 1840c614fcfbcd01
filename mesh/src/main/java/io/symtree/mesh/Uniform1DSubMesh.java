// file: src/main/java/io/symtree/mesh/Uniform1DSubMesh.java
package io.symtree.mesh;

import io.symtree.core.CoordinateSystem;
import io.symtree.core.SpatialVariable;

import java.util.Map;

/** Equally spaced 1D sub-mesh: npts cells, npts+1 edges. */
public final class Uniform1DSubMesh extends SubMesh1D {

    private Uniform1DSubMesh(double[] edges, CoordinateSystem coordSys) {
        super(edges, coordSys);
    }

    public static Uniform1DSubMesh create(Map<SpatialVariable, Interval> lims, VarPts npts) {
        var entry = single(lims);
        SpatialVariable var = entry.getKey();
        Interval range = entry.getValue();
        int n = npts.pointsFor(var);

        double[] edges = new double[n + 1];
        for (int i = 0; i <= n; i++) {
            edges[i] = range.min() + range.length() * i / n;
        }
        // avoid rounding drift on the last edge
        edges[n] = range.max();
        return new Uniform1DSubMesh(edges, var.coordSys());
    }
}
