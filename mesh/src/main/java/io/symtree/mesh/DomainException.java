// file: src/main/java/io/symtree/mesh/DomainException.java
package io.symtree.mesh;

/** Spatial variables or domains are incompatible with the requested sub-mesh. */
public class DomainException extends IllegalArgumentException {

    public DomainException(String message) {
        super(message);
    }
}
