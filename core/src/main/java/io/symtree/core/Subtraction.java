// file: src/main/java/io/symtree/core/Subtraction.java
package io.symtree.core;

/** {@code left - right}. */
public final class Subtraction extends BinaryOperator {

    public Subtraction(Symbol left, Symbol right) {
        super(Operator.SUBTRACT, left, right);
    }

    @Override
    protected Value combine(Value left, Value right) {
        return left.minus(right);
    }
}
