// file: src/main/java/io/symtree/core/Value.java
package io.symtree.core;

import java.util.Arrays;
import java.util.function.DoubleBinaryOperator;

/**
 * Result of evaluating an expression: a single real number or an array.
 * <p>
 * Arithmetic is element-wise:
 *  - Real op Real:   Real.
 *  - Real op Array:  the real is broadcast over the array (either side).
 *  - Array op Array: lengths must match, otherwise IllegalArgumentException.
 * <p>
 * Values are immutable; array contents are copied on the way in and out.
 */
public sealed interface Value permits Value.Real, Value.Array {

    static Value real(double value) {
        return new Real(value);
    }

    static Value array(double... values) {
        return new Array(values);
    }

    /** Number of entries (1 for a real). */
    int size();

    /** Entries as a fresh array. */
    double[] toArray();

    /**
     * The single number this value holds.
     *
     * @throws IllegalStateException for arrays with more than one entry
     */
    double asDouble();

    default boolean isFinite() {
        for (double d : toArray()) {
            if (!Double.isFinite(d)) return false;
        }
        return true;
    }

    default Value plus(Value other) {
        return apply(this, other, Double::sum);
    }

    default Value minus(Value other) {
        return apply(this, other, (a, b) -> a - b);
    }

    default Value times(Value other) {
        return apply(this, other, (a, b) -> a * b);
    }

    default Value dividedBy(Value other) {
        return apply(this, other, (a, b) -> a / b);
    }

    private static Value apply(Value left, Value right, DoubleBinaryOperator op) {
        if (left instanceof Real l && right instanceof Real r) {
            return new Real(op.applyAsDouble(l.value(), r.value()));
        }
        double[] a = left.toArray();
        double[] b = right.toArray();
        if (left instanceof Real) {
            a = broadcast(a[0], b.length);
        } else if (right instanceof Real) {
            b = broadcast(b[0], a.length);
        } else if (a.length != b.length) {
            throw new IllegalArgumentException(
                    "shape mismatch: cannot combine arrays of length %d and %d".formatted(a.length, b.length));
        }
        double[] out = new double[a.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = op.applyAsDouble(a[i], b[i]);
        }
        return new Array(out);
    }

    private static double[] broadcast(double v, int n) {
        double[] out = new double[n];
        Arrays.fill(out, v);
        return out;
    }

    record Real(double value) implements Value {
        @Override public int size() { return 1; }

        @Override public double[] toArray() { return new double[] { value }; }

        @Override public double asDouble() { return value; }

        @Override public String toString() { return String.valueOf(value); }
    }

    record Array(double[] values) implements Value {
        public Array {
            values = values.clone();
        }

        @Override public double[] values() { return values.clone(); }

        @Override public int size() { return values.length; }

        @Override public double[] toArray() { return values.clone(); }

        @Override public double asDouble() {
            if (values.length != 1) {
                throw new IllegalStateException("array of length " + values.length + " is not a single number");
            }
            return values[0];
        }

        @Override public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Array other)) return false;
            return Arrays.equals(values, other.values);
        }

        @Override public int hashCode() { return Arrays.hashCode(values); }

        @Override public String toString() { return Arrays.toString(values); }
    }
}
