package com.frosted.tracer.syntax.node;

import java.util.List;

public final class ReturnNode extends Node {
    private final int value;

    public ReturnNode(int id, Span span, int value) {
        super(id, span);
        this.value = value;
    }

    public int getValue() { return value; }

    public boolean hasValue() {
        return value != NONE;
    }

    @Override
    public NodeKind kind() { return NodeKind.RETURN; }

    @Override
    public List<Integer> children() { return ids(value); }
}
