// file: src/main/java/io/symtree/core/Scalar.java
package io.symtree.core;

/**
 * Constant leaf. Named by its value unless a name is given.
 */
public final class Scalar extends Leaf {

    private final double value;

    public Scalar(double value) {
        this(value, String.valueOf(value));
    }

    public Scalar(double value, String name) {
        super(name);
        this.value = value;
    }

    public double value() {
        return value;
    }

    /** Returns the constant, whatever {@code t} and {@code y} are. */
    @Override
    public Value evaluate(Double t, double[] y) {
        return Value.real(value);
    }

    @Override
    public Scalar copy() {
        return new Scalar(value, name());
    }
}
