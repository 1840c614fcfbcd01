// file: src/main/java/io/symtree/mesh/Limits.java
package io.symtree.mesh;

import io.symtree.core.Evaluator;
import io.symtree.core.Scalar;
import io.symtree.core.Symbol;

import java.util.Objects;

/**
 * Limits of a spatial variable as expressions, usually {@link Scalar}s.
 * They are evaluated without {@code t} or {@code y} when a mesh is built.
 */
public record Limits(Symbol min, Symbol max) {
    public Limits {
        Objects.requireNonNull(min, "min");
        Objects.requireNonNull(max, "max");
    }

    public static Limits of(double min, double max) {
        return new Limits(new Scalar(min), new Scalar(max));
    }

    Interval evaluate(Evaluator evaluator) {
        return new Interval(
                evaluator.evaluate(min).asDouble(),
                evaluator.evaluate(max).asDouble()
        );
    }
}
