// file: src/main/java/io/symtree/core/EvaluationNotImplementedException.java
package io.symtree.core;

/**
 * {@code evaluate} was called on a node whose kind has no evaluation semantics
 * (a plain {@link Symbol}, a free {@link Variable}, ...).
 * This is a programming error and is never caught inside the tree engine.
 */
public final class EvaluationNotImplementedException extends UnsupportedOperationException {

    private final String symbolName;
    private final String kind;

    public EvaluationNotImplementedException(String symbolName, String kind) {
        super("evaluate() not implemented for symbol %s of kind %s".formatted(symbolName, kind));
        this.symbolName = symbolName;
        this.kind = kind;
    }

    public String symbolName() {
        return symbolName;
    }

    public String kind() {
        return kind;
    }
}
