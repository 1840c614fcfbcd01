// file: src/main/java/io/symtree/mesh/SubMeshType.java
package io.symtree.mesh;

import io.symtree.core.SpatialVariable;

import java.util.Map;

/** Built-in sub-mesh kinds, addressable by the label used in geometry files. */
public enum SubMeshType implements SubMeshFactory {
    UNIFORM("uniform", Uniform1DSubMesh::create),
    CHEBYSHEV("chebyshev", Chebyshev1DSubMesh::create),
    CHEBYSHEV_2D("chebyshev2d", Chebyshev2DSubMesh::create);

    private final String label;
    private final SubMeshFactory factory;

    SubMeshType(String label, SubMeshFactory factory) {
        this.label = label;
        this.factory = factory;
    }

    public String label() {
        return label;
    }

    @Override
    public SubMesh create(Map<SpatialVariable, Interval> lims, VarPts npts) {
        return factory.create(lims, npts);
    }

    public static SubMeshType fromLabel(String label) {
        for (var t : values()) {
            if (t.label.equals(label)) return t;
        }
        throw new IllegalArgumentException("unknown sub-mesh type: " + label);
    }
}
