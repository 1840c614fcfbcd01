// file: src/main/java/io/symtree/mesh/VarPts.java
package io.symtree.mesh;

import io.symtree.core.SpatialVariable;

import java.util.HashMap;
import java.util.Map;

/**
 * Number of points per spatial variable, keyed by the variable's structural id.
 * <p>
 * Keying by id means any structurally equal variable (a copy taken from an
 * expression tree, or one rebuilt from configuration) finds the same count.
 */
public final class VarPts {

    /** Largest count whose edge and node arrays still fit in a Java array. */
    public static final int MAX_POINTS = Integer.MAX_VALUE - 8;

    private final Map<Long, Integer> byId;

    private VarPts(Map<Long, Integer> byId) {
        this.byId = Map.copyOf(byId);
    }

    /**
     * @throws GeometryException for counts outside [1, MAX_POINTS], or two structurally equal
     *                           variables given different counts
     */
    public static VarPts of(Map<SpatialVariable, Integer> points) {
        var byId = new HashMap<Long, Integer>();
        points.forEach((variable, count) -> {
            if (count == null || count <= 0) {
                throw new GeometryException("number of points for %s must be > 0, got %s".formatted(variable, count));
            }
            if (count > MAX_POINTS) {
                throw new GeometryException("number of points for %s must be <= %d, got %d"
                        .formatted(variable, MAX_POINTS, count));
            }
            Integer previous = byId.putIfAbsent(variable.id(), count);
            if (previous != null && !previous.equals(count)) {
                throw new GeometryException("conflicting number of points for %s: %d and %d"
                        .formatted(variable, previous, count));
            }
        });
        return new VarPts(byId);
    }

    public boolean contains(SpatialVariable variable) {
        return byId.containsKey(variable.id());
    }

    /**
     * @throws GeometryException if no count was given for {@code variable}
     */
    public int pointsFor(SpatialVariable variable) {
        Integer n = byId.get(variable.id());
        if (n == null) throw new GeometryException("no number of points given for spatial variable " + variable);
        return n;
    }

    public int size() {
        return byId.size();
    }
}
