// file: src/main/java/io/symtree/core/StateVector.java
package io.symtree.core;

import java.util.Arrays;

/**
 * Slice {@code y[start:stop)} of the solver state vector.
 * <p>
 * Named {@code y[start:stop]}, so different slices have different ids and
 * identical slices coalesce in a {@link SubtreeIndex}.
 */
public final class StateVector extends Leaf {

    private final int start;
    private final int stop;

    public StateVector(int start, int stop) {
        super(sliceName(start, stop));
        this.start = start;
        this.stop = stop;
    }

    public int start() {
        return start;
    }

    public int stop() {
        return stop;
    }

    public int size() {
        return stop - start;
    }

    @Override
    public Value evaluate(Double t, double[] y) {
        if (y == null) {
            throw new IllegalArgumentException("y must be provided to evaluate " + name());
        }
        if (y.length < stop) {
            throw new IllegalArgumentException(
                    "y has %d entries, %s needs at least %d".formatted(y.length, name(), stop));
        }
        return Value.array(Arrays.copyOfRange(y, start, stop));
    }

    @Override
    public StateVector copy() {
        return new StateVector(start, stop);
    }

    private static String sliceName(int start, int stop) {
        if (start < 0) throw new IllegalArgumentException("start must be >= 0");
        if (stop <= start) throw new IllegalArgumentException("stop must be > start");
        return "y[%d:%d]".formatted(start, stop);
    }
}
