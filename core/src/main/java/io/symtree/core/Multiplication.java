// file: src/main/java/io/symtree/core/Multiplication.java
package io.symtree.core;

/** Element-wise {@code left * right}. */
public final class Multiplication extends BinaryOperator {

    public Multiplication(Symbol left, Symbol right) {
        super(Operator.MULTIPLY, left, right);
    }

    @Override
    protected Value combine(Value left, Value right) {
        return left.times(right);
    }
}
