// file: src/main/java/io/symtree/core/Leaf.java
package io.symtree.core;

/**
 * Terminal node: carries a value or a reference, never children.
 * Concrete leaves must supply both evaluation semantics and a clone.
 */
public abstract class Leaf extends Symbol {

    protected Leaf(String name) {
        super(name);
    }

    @Override
    public abstract Value evaluate(Double t, double[] y);

    @Override
    public abstract Leaf copy();
}
