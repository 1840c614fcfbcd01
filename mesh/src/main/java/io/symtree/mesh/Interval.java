// file: src/main/java/io/symtree/mesh/Interval.java
package io.symtree.mesh;

/** Evaluated limits {@code [min, max]} of one spatial variable; {@code max > min}. */
public record Interval(double min, double max) {
    public Interval {
        if (!Double.isFinite(min) || !Double.isFinite(max)) {
            throw new GeometryException("limits must be finite, got [%s, %s]".formatted(min, max));
        }
        if (!(max > min)) {
            throw new GeometryException("max must be greater than min, got [%s, %s]".formatted(min, max));
        }
    }

    public double length() {
        return max - min;
    }
}
