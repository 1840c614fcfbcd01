// file: src/main/java/io/symtree/core/BinaryOperator.java
package io.symtree.core;

import java.util.List;

/**
 * Node combining exactly two children with an arithmetic {@link Operator}.
 * <p>
 * Evaluation is left child, then right child, then {@link #combine}. A failing
 * child propagates unchanged; nothing is caught here.
 */
public abstract class BinaryOperator extends Symbol {

    private final Operator operator;

    protected BinaryOperator(Operator operator, Symbol left, Symbol right) {
        super(operator.symbol(), List.of(operator.requireSymbol(left), operator.requireSymbol(right)));
        this.operator = operator;
    }

    public final Operator operator() {
        return operator;
    }

    public final Symbol left() {
        return children().get(0);
    }

    public final Symbol right() {
        return children().get(1);
    }

    @Override
    public final Value evaluate(Double t, double[] y) {
        Value l = left().evaluate(t, y);
        Value r = right().evaluate(t, y);
        return combine(l, r);
    }

    /** Apply this operator to already evaluated operands. */
    protected abstract Value combine(Value left, Value right);

    @Override
    public final BinaryOperator copy() {
        return operator.build(left(), right());
    }
}
