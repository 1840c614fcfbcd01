// file: src/main/java/io/symtree/core/RenderStyle.java
package io.symtree.core;

/**
 * Line prefixes used by {@link TreeRenderer}.
 */
public enum RenderStyle {
    UNICODE("│   ", "├── ", "└── "),
    ASCII("|   ", "|-- ", "+-- ");

    private final String vertical;
    private final String branch;
    private final String end;

    RenderStyle(String vertical, String branch, String end) {
        this.vertical = vertical;
        this.branch = branch;
        this.end = end;
    }

    /** Continuation of an ancestor that still has siblings below. */
    public String vertical() {
        return vertical;
    }

    /** Prefix of a child that has later siblings. */
    public String branch() {
        return branch;
    }

    /** Prefix of the last child. */
    public String end() {
        return end;
    }

    /** Indentation under a last child; as wide as the other prefixes. */
    public String blank() {
        return " ".repeat(end.length());
    }
}
