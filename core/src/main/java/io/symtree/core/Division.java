// file: src/main/java/io/symtree/core/Division.java
package io.symtree.core;

/** Element-wise {@code left / right}; division by zero follows IEEE-754. */
public final class Division extends BinaryOperator {

    public Division(Symbol left, Symbol right) {
        super(Operator.DIVIDE, left, right);
    }

    @Override
    protected Value combine(Value left, Value right) {
        return left.dividedBy(right);
    }
}
