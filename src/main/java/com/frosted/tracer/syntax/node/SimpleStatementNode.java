package com.frosted.tracer.syntax.node;

import java.util.List;

/**
 * {@code break}, {@code continue} and {@code pass}: statements without operands.
 */
public final class SimpleStatementNode extends Node {
    private final NodeKind kind;

    public SimpleStatementNode(int id, Span span, NodeKind kind) {
        super(id, span);
        if (kind != NodeKind.BREAK && kind != NodeKind.CONTINUE && kind != NodeKind.PASS) {
            throw new IllegalArgumentException("Not a simple statement: " + kind);
        }
        this.kind = kind;
    }

    @Override
    public NodeKind kind() { return kind; }

    @Override
    public List<Integer> children() { return List.of(); }
}
