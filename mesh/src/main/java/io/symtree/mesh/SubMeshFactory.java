// file: src/main/java/io/symtree/mesh/SubMeshFactory.java
package io.symtree.mesh;

import io.symtree.core.SpatialVariable;

import java.util.Map;

/**
 * Builds a sub-mesh from evaluated limits and point counts.
 * Implementations validate their input before building anything.
 */
@FunctionalInterface
public interface SubMeshFactory {

    SubMesh create(Map<SpatialVariable, Interval> lims, VarPts npts);
}
