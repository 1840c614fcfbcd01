// file: src/main/java/io/symtree/core/Time.java
package io.symtree.core;

/** The independent variable {@code t}. */
public final class Time extends Leaf {

    public Time() {
        super("t");
    }

    @Override
    public Value evaluate(Double t, double[] y) {
        if (t == null) {
            throw new IllegalArgumentException("t must be provided to evaluate " + name());
        }
        return Value.real(t);
    }

    @Override
    public Time copy() {
        return new Time();
    }
}
