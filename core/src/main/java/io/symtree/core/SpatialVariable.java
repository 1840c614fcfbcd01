// file: src/main/java/io/symtree/core/SpatialVariable.java
package io.symtree.core;

import java.util.List;
import java.util.Objects;

/**
 * Independent spatial coordinate (x, r, y, z, ...) over some domains.
 * <p>
 * Mesh code reads {@link #name()}, {@link #coordSys()} and {@link #id()} from these
 * leaves; the id is used as the lookup key for per-variable point counts.
 * A spatial variable only has values once discretized, so it cannot be evaluated.
 */
public final class SpatialVariable extends Leaf {

    private final List<String> domain;
    private final CoordinateSystem coordSys;

    public SpatialVariable(String name, List<String> domain) {
        this(name, domain, CoordinateSystem.CARTESIAN);
    }

    public SpatialVariable(String name, List<String> domain, CoordinateSystem coordSys) {
        super(name);
        this.domain = List.copyOf(domain);
        this.coordSys = Objects.requireNonNull(coordSys, "coordSys");
    }

    public List<String> domain() {
        return domain;
    }

    public CoordinateSystem coordSys() {
        return coordSys;
    }

    @Override
    public Value evaluate(Double t, double[] y) {
        throw new EvaluationNotImplementedException(name(), kind());
    }

    @Override
    public SpatialVariable copy() {
        return new SpatialVariable(name(), domain, coordSys);
    }
}
