package com.frosted.tracer.syntax.node;

/**
 * Source range of a node: inclusive start and end lines plus the start column, all 1-based.
 */
public final class Span {
    private final int startLine;
    private final int endLine;
    private final int column;

    public Span(int startLine, int endLine, int column) {
        if (endLine < startLine) {
            throw new IllegalArgumentException("Span ends (" + endLine + ") before it starts (" + startLine + ")");
        }
        this.startLine = startLine;
        this.endLine = endLine;
        this.column = column;
    }

    public int getStartLine() { return startLine; }

    public int getEndLine() { return endLine; }

    public int getColumn() { return column; }

    public boolean contains(Span other) {
        return other.startLine >= startLine && other.endLine <= endLine;
    }

    @Override
    public String toString() {
        return startLine + "-" + endLine + ":" + column;
    }
}
