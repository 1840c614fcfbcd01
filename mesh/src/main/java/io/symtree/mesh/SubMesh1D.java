// file: src/main/java/io/symtree/mesh/SubMesh1D.java
package io.symtree.mesh;

import io.symtree.core.CoordinateSystem;
import io.symtree.core.SpatialVariable;

import java.util.Map;
import java.util.Objects;

/**
 * One-dimensional sub-mesh.
 * <p>
 * Layout:
 *  - edges:  n+1 strictly increasing positions, first and last are the limits
 *  - nodes:  n cell centres, nodes[i] = (edges[i] + edges[i+1]) / 2
 *  - dEdges: n edge spacings
 *  - dNodes: n-1 node spacings
 */
public class SubMesh1D implements SubMesh {

    private final double[] edges;
    private final double[] nodes;
    private final CoordinateSystem coordSys;

    protected SubMesh1D(double[] edges, CoordinateSystem coordSys) {
        Objects.requireNonNull(edges, "edges");
        if (edges.length < 2) throw new GeometryException("a 1D sub-mesh needs at least 2 edges");
        for (int i = 1; i < edges.length; i++) {
            if (!(edges[i] > edges[i - 1])) {
                throw new GeometryException("edges must be strictly increasing (index %d)".formatted(i));
            }
        }
        this.edges = edges.clone();
        this.nodes = new double[edges.length - 1];
        for (int i = 0; i < nodes.length; i++) {
            nodes[i] = (edges[i] + edges[i + 1]) / 2;
        }
        this.coordSys = Objects.requireNonNull(coordSys, "coordSys");
    }

    public double[] edges() {
        return edges.clone();
    }

    public double[] nodes() {
        return nodes.clone();
    }

    public double[] dEdges() {
        return diff(edges);
    }

    public double[] dNodes() {
        return diff(nodes);
    }

    /** Number of nodes. */
    public int npts() {
        return nodes.length;
    }

    @Override
    public CoordinateSystem coordSys() {
        return coordSys;
    }

    /**
     * The only entry of {@code lims}.
     *
     * @throws GeometryException unless exactly one variable is given
     */
    static Map.Entry<SpatialVariable, Interval> single(Map<SpatialVariable, Interval> lims) {
        if (lims.size() != 1) {
            throw new GeometryException("lims should contain exactly one variable, not " + lims.size());
        }
        return lims.entrySet().iterator().next();
    }

    private static double[] diff(double[] xs) {
        double[] out = new double[Math.max(0, xs.length - 1)];
        for (int i = 0; i < out.length; i++) {
            out[i] = xs[i + 1] - xs[i];
        }
        return out;
    }
}
