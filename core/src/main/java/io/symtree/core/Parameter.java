// file: src/main/java/io/symtree/core/Parameter.java
package io.symtree.core;

/**
 * Named model parameter. Values are bound by substituting the leaf before
 * evaluation; a free parameter cannot be evaluated.
 */
public final class Parameter extends Leaf {

    public Parameter(String name) {
        super(name);
    }

    @Override
    public Value evaluate(Double t, double[] y) {
        throw new EvaluationNotImplementedException(name(), kind());
    }

    @Override
    public Parameter copy() {
        return new Parameter(name());
    }
}
