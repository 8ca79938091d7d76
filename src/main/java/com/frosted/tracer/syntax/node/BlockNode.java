package com.frosted.tracer.syntax.node;

import java.util.List;

/**
 * Statement sequence of a body. Records whether the body carried its delimiter (':' or braces)
 * and where its header sits, for the indentation and delimiter rules.
 */
public final class BlockNode extends Node {
    private final List<Integer> statements;
    private final boolean delimited;
    private final int headerLine;
    private final int headerColumn;

    public BlockNode(int id, Span span, List<Integer> statements, boolean delimited, int headerLine, int headerColumn) {
        super(id, span);
        this.statements = copy(statements);
        this.delimited = delimited;
        this.headerLine = headerLine;
        this.headerColumn = headerColumn;
    }

    public List<Integer> getStatements() { return statements; }

    public boolean isDelimited() { return delimited; }

    public int getHeaderLine() { return headerLine; }

    public int getHeaderColumn() { return headerColumn; }

    @Override
    public NodeKind kind() { return NodeKind.BLOCK; }

    @Override
    public List<Integer> children() { return statements; }
}
