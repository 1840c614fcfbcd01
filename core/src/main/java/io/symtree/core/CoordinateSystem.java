// file: src/main/java/io/symtree/core/CoordinateSystem.java
package io.symtree.core;

/**
 * Coordinate system a spatial variable is measured in.
 * Labels match the ones used in geometry configuration files.
 */
public enum CoordinateSystem {
    CARTESIAN("cartesian"),
    CYLINDRICAL_POLAR("cylindrical polar"),
    SPHERICAL_POLAR("spherical polar");

    private final String label;

    CoordinateSystem(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static CoordinateSystem fromLabel(String label) {
        for (var cs : values()) {
            if (cs.label.equals(label)) return cs;
        }
        throw new IllegalArgumentException("unknown coordinate system: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
