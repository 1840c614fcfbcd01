// file: src/main/java/io/symtree/core/Operator.java
package io.symtree.core;

import java.util.function.BiFunction;

/**
 * The arithmetic operators and their node factories.
 * <p>
 * Every way of building a binary node ({@link Symbol#add} and friends, or
 * {@link #build} directly) goes through the same operand check, so a bad
 * operand is rejected before any node exists.
 */
public enum Operator {
    ADD("+", Addition::new),
    SUBTRACT("-", Subtraction::new),
    MULTIPLY("*", Multiplication::new),
    DIVIDE("/", Division::new);

    private final String symbol;
    private final BiFunction<Symbol, Symbol, BinaryOperator> factory;

    Operator(String symbol, BiFunction<Symbol, Symbol, BinaryOperator> factory) {
        this.symbol = symbol;
        this.factory = factory;
    }

    /** Canonical symbol, also the name of the nodes this operator builds. */
    public String symbol() {
        return symbol;
    }

    /**
     * Build {@code self <op> other}. Children are clones of both operands.
     *
     * @throws UnsupportedOperandException if either operand is not a Symbol
     */
    public BinaryOperator build(Symbol self, Object other) {
        return factory.apply(requireSymbol(self), requireSymbol(other));
    }

    Symbol requireSymbol(Object operand) {
        if (operand instanceof Symbol s) return s;
        throw new UnsupportedOperandException(this, operand);
    }
}
