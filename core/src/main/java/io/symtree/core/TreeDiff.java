// file: src/main/java/io/symtree/core/TreeDiff.java
package io.symtree.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Locates where two expression trees differ, using structural ids.
 * <p>
 *  - If the root ids are equal, the trees are interchangeable and the result is empty.
 *  - Otherwise descend while both sides have the same kind, name and arity;
 *    equal child ids prune the subtree.
 *  - The first position where kinds, names or arities disagree (or a differing
 *    leaf) is reported as one Difference.
 */
public final class TreeDiff {

    private TreeDiff() {}

    /**
     * One differing position.
     *
     * @param path  child indexes from the root (empty for the root itself)
     * @param left  node of the left tree at that position
     * @param right node of the right tree at that position
     */
    public record Difference(List<Integer> path, Symbol left, Symbol right) {
        public Difference {
            path = List.copyOf(path);
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    public static List<Difference> findDifferences(Symbol left, Symbol right) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");

        Map<Symbol, Long> leftIds = StructuralHasher.fingerprintAll(left);
        Map<Symbol, Long> rightIds = StructuralHasher.fingerprintAll(right);

        List<Difference> out = new ArrayList<>();
        diffNode(left, right, new ArrayList<>(), leftIds, rightIds, out);
        return out;
    }

    private static void diffNode(
            Symbol l,
            Symbol r,
            List<Integer> path,
            Map<Symbol, Long> leftIds,
            Map<Symbol, Long> rightIds,
            List<Difference> out
    ) {
        if (leftIds.get(l).longValue() == rightIds.get(r).longValue()) {
            return;
        }

        boolean sameShape = l.getClass() == r.getClass()
                && l.name().equals(r.name())
                && l.children().size() == r.children().size();
        if (!sameShape || l.isLeaf()) {
            out.add(new Difference(path, l, r));
            return;
        }

        for (int i = 0; i < l.children().size(); i++) {
            path.add(i);
            diffNode(l.children().get(i), r.children().get(i), path, leftIds, rightIds, out);
            path.remove(path.size() - 1);
        }
    }
}
