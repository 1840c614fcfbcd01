// file: src/main/java/io/symtree/mesh/GeometryException.java
package io.symtree.mesh;

/** Geometry input has the wrong shape (variable count, missing point counts, bad limits, ...). */
public class GeometryException extends IllegalArgumentException {

    public GeometryException(String message) {
        super(message);
    }

    public GeometryException(String message, Throwable cause) {
        super(message, cause);
    }
}
