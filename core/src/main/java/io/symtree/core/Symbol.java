// file: src/main/java/io/symtree/core/Symbol.java
package io.symtree.core;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Base node of the expression tree.
 * <p>
 * Ownership model:
 *  - Every child passed to the constructor is cloned with {@link #copy()} before
 *    it is attached, so the caller's node is never re-parented or shared.
 *  - A node therefore has at most one parent, and cycles cannot be built.
 *  - There is no mutation API: larger expressions are always new nodes.
 * <p>
 * Identity:
 *  - {@link #id()} is the structural fingerprint (kind, name, children ids).
 *    Two trees with the same shape and content have the same id.
 *  - {@code equals}/{@code hashCode} stay reference based, so nodes can be kept
 *    in identity containers by traversal and bookkeeping code.
 * <p>
 * Thread safety: immutable after construction, ids are not cached, so
 * concurrent evaluation and traversal need no locking.
 */
public class Symbol {

    private final String name;
    private final List<Symbol> children;

    // Non-owning back reference, assigned once by the owner's constructor.
    private Symbol parent;

    public Symbol(String name) {
        this(name, null);
    }

    /**
     * Create a node owning clones of {@code children}, in order.
     * A null list is treated as a fresh empty list.
     */
    public Symbol(String name, List<? extends Symbol> children) {
        this.name = Objects.requireNonNull(name, "name");
        var owned = new ArrayList<Symbol>(children == null ? 0 : children.size());
        if (children != null) {
            for (Symbol child : children) {
                Objects.requireNonNull(child, "child");
                Symbol attached = child.copy();
                attached.parent = this;
                owned.add(attached);
            }
        }
        this.children = Collections.unmodifiableList(owned);
    }

    public final String name() {
        return name;
    }

    /** Owned children, in order (read-only view). */
    public final List<Symbol> children() {
        return children;
    }

    public final Optional<Symbol> parent() {
        return Optional.ofNullable(parent);
    }

    public final boolean isLeaf() {
        return children.isEmpty();
    }

    /** Short identifier of the concrete node kind, used in messages and rendering. */
    public final String kind() {
        return getClass().getSimpleName();
    }

    /**
     * Structural fingerprint of this subtree.
     * Recomputed on each call; stable across runs since it is derived from SHA-256.
     */
    public final long id() {
        return StructuralHasher.fingerprint(this);
    }

    /**
     * Return an unattached clone with the same id.
     * Subclasses must override this; the base implementation only clones plain symbols.
     */
    public Symbol copy() {
        if (getClass() != Symbol.class) {
            throw new IllegalStateException(getClass().getName() + " must override copy()");
        }
        return new Symbol(name, children);
    }

    // ---------------- tree builder ----------------

    public final BinaryOperator add(Symbol other) {
        return Operator.ADD.build(this, other);
    }

    public final BinaryOperator subtract(Symbol other) {
        return Operator.SUBTRACT.build(this, other);
    }

    public final BinaryOperator multiply(Symbol other) {
        return Operator.MULTIPLY.build(this, other);
    }

    public final BinaryOperator divide(Symbol other) {
        return Operator.DIVIDE.build(this, other);
    }

    // ---------------- evaluation ----------------

    /**
     * Evaluate this expression at time {@code t} for state vector {@code y}.
     * Both arguments are optional (null when absent).
     * <p>
     * Plain symbols carry no semantics and always fail; every concrete kind overrides this.
     *
     * @throws EvaluationNotImplementedException if this kind cannot be evaluated
     */
    public Value evaluate(Double t, double[] y) {
        throw new EvaluationNotImplementedException(name, kind());
    }

    public final Value evaluate() {
        return evaluate(null, null);
    }

    // ---------------- traversal & rendering ----------------

    /** Depth-first, node before children, children left to right. Each iterator is independent. */
    public final Iterable<Symbol> preOrder() {
        return new PreOrder(this);
    }

    public final Stream<Symbol> stream() {
        return StreamSupport.stream(preOrder().spliterator(), false);
    }

    /** Print the tree diagram to standard output. */
    public final void render() {
        render(System.out);
    }

    public final void render(PrintStream out) {
        new TreeRenderer(TreeSettings.defaults().renderStyle()).render(this, out);
    }

    public final String renderToString() {
        return new TreeRenderer(TreeSettings.defaults().renderStyle()).renderToString(this);
    }

    /** Diagnostic form: {@code Kind(name, parentName)}. */
    public final String display() {
        return "%s(%s, %s)".formatted(kind(), name, parent == null ? "none" : parent.name);
    }

    @Override
    public final String toString() {
        return name;
    }
}
