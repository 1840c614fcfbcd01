// file: src/main/java/io/symtree/core/SubtreeIndex.java
package io.symtree.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Distinct subtrees of an expression, keyed by structural id.
 * <p>
 * Structurally identical subexpressions (for example the same state-vector
 * slice referenced twice) collapse to one entry; the first node met in
 * pre-order is the representative. Built once, read-only afterwards.
 */
public final class SubtreeIndex {

    private final Map<Long, Symbol> firstById;
    private final Map<Long, Integer> occurrences;

    private SubtreeIndex(Map<Long, Symbol> firstById, Map<Long, Integer> occurrences) {
        this.firstById = firstById;
        this.occurrences = occurrences;
    }

    public static SubtreeIndex of(Symbol root) {
        Map<Symbol, Long> ids = StructuralHasher.fingerprintAll(root);
        var first = new LinkedHashMap<Long, Symbol>();
        var counts = new LinkedHashMap<Long, Integer>();
        for (Symbol node : root.preOrder()) {
            long id = ids.get(node);
            first.putIfAbsent(id, node);
            counts.merge(id, 1, Integer::sum);
        }
        return new SubtreeIndex(first, counts);
    }

    /** Distinct state-vector leaves of {@code root}, in pre-order of first appearance. */
    public static List<StateVector> stateVectors(Symbol root) {
        var out = new ArrayList<StateVector>();
        for (Symbol node : of(root).distinct()) {
            if (node instanceof StateVector sv) out.add(sv);
        }
        return out;
    }

    public Optional<Symbol> get(long id) {
        return Optional.ofNullable(firstById.get(id));
    }

    public boolean contains(long id) {
        return firstById.containsKey(id);
    }

    /** How many nodes of the tree have this id (0 if none). */
    public int occurrences(long id) {
        return occurrences.getOrDefault(id, 0);
    }

    public int size() {
        return firstById.size();
    }

    /** One representative per distinct subtree, in pre-order of first appearance. */
    public List<Symbol> distinct() {
        return List.copyOf(firstById.values());
    }
}
