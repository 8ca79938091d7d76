package com.frosted.tracer.syntax.node;

import java.util.List;

public final class IdentifierNode extends Node {
    private final String name;

    public IdentifierNode(int id, Span span, String name) {
        super(id, span);
        this.name = name;
    }

    public String getName() { return name; }

    @Override
    public NodeKind kind() { return NodeKind.IDENTIFIER; }

    @Override
    public List<Integer> children() { return List.of(); }
}
