// file: src/main/java/io/symtree/core/UnsupportedOperandException.java
package io.symtree.core;

/**
 * An arithmetic builder got an operand that is not a {@link Symbol}
 * (a plain number, null, ...). Raised before any node is created.
 */
public final class UnsupportedOperandException extends IllegalArgumentException {

    private final Operator operator;
    private final String operandType;

    public UnsupportedOperandException(Operator operator, Object operand) {
        super("unsupported operand for '%s': %s".formatted(
                operator.symbol(),
                operand == null ? "null" : operand.getClass().getName() + " (" + operand + ")"));
        this.operator = operator;
        this.operandType = operand == null ? "null" : operand.getClass().getName();
    }

    public Operator operator() {
        return operator;
    }

    public String operandType() {
        return operandType;
    }
}
