// file: src/main/java/io/symtree/mesh/SubMesh.java
package io.symtree.mesh;

import io.symtree.core.CoordinateSystem;

/** Point distribution over one domain. */
public interface SubMesh {

    CoordinateSystem coordSys();
}
