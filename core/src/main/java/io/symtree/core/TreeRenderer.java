// file: src/main/java/io/symtree/core/TreeRenderer.java
package io.symtree.core;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Indented tree diagram, one line per node, in pre-order:
 * <pre>
 * *
 * ├── +
 * │   ├── a
 * │   └── b
 * └── c
 * </pre>
 */
public final class TreeRenderer {

    private final RenderStyle style;

    public TreeRenderer(RenderStyle style) {
        this.style = Objects.requireNonNull(style, "style");
    }

    public TreeRenderer(TreeSettings settings) {
        this(settings.renderStyle());
    }

    public List<String> lines(Symbol root) {
        var out = new ArrayList<String>();
        out.add(root.toString());
        appendChildren(root, "", out);
        return out;
    }

    public void render(Symbol root, PrintStream out) {
        for (String line : lines(root)) {
            out.println(line);
        }
    }

    /** Lines joined with '\n', no trailing newline. */
    public String renderToString(Symbol root) {
        return String.join("\n", lines(root));
    }

    private void appendChildren(Symbol node, String indent, List<String> out) {
        List<Symbol> children = node.children();
        for (int i = 0; i < children.size(); i++) {
            Symbol child = children.get(i);
            boolean last = i == children.size() - 1;
            out.add(indent + (last ? style.end() : style.branch()) + child);
            appendChildren(child, indent + (last ? style.blank() : style.vertical()), out);
        }
    }
}
