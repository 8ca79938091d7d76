package com.frosted.tracer.syntax.node;

import java.util.List;

public final class WhileNode extends Node {
    private final int condition;
    private final int body;

    public WhileNode(int id, Span span, int condition, int body) {
        super(id, span);
        this.condition = condition;
        this.body = body;
    }

    public int getCondition() { return condition; }

    public int getBody() { return body; }

    @Override
    public NodeKind kind() { return NodeKind.WHILE; }

    @Override
    public List<Integer> children() { return ids(condition, body); }
}
