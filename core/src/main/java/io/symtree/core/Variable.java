// file: src/main/java/io/symtree/core/Variable.java
package io.symtree.core;

import java.util.List;

/**
 * Free model variable living on a list of domains (for example "negative electrode").
 * It has no value until it is discretized into a state vector, so it cannot be evaluated.
 */
public final class Variable extends Leaf {

    private final List<String> domain;

    public Variable(String name) {
        this(name, List.of());
    }

    public Variable(String name, List<String> domain) {
        super(name);
        this.domain = List.copyOf(domain);
    }

    public List<String> domain() {
        return domain;
    }

    @Override
    public Value evaluate(Double t, double[] y) {
        throw new EvaluationNotImplementedException(name(), kind());
    }

    @Override
    public Variable copy() {
        return new Variable(name(), domain);
    }
}
