// file: src/main/java/io/symtree/core/PreOrder.java
package io.symtree.core;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Pre-order view of a tree. Every {@link #iterator()} call returns a fresh
 * cursor with its own stack, so the view can be walked any number of times.
 */
final class PreOrder implements Iterable<Symbol> {

    private final Symbol root;

    PreOrder(Symbol root) {
        this.root = root;
    }

    @Override
    public Iterator<Symbol> iterator() {
        return new Cursor(root);
    }

    private static final class Cursor implements Iterator<Symbol> {
        private final Deque<Symbol> stack = new ArrayDeque<>();

        Cursor(Symbol root) {
            stack.push(root);
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public Symbol next() {
            if (stack.isEmpty()) throw new NoSuchElementException();
            Symbol node = stack.pop();
            List<Symbol> children = node.children();
            // push right to left so the leftmost child is visited first
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
            return node;
        }
    }
}
