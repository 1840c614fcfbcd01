// file: src/main/java/io/symtree/core/Addition.java
package io.symtree.core;

/** {@code left + right}. */
public final class Addition extends BinaryOperator {

    public Addition(Symbol left, Symbol right) {
        super(Operator.ADD, left, right);
    }

    @Override
    protected Value combine(Value left, Value right) {
        return left.plus(right);
    }
}
