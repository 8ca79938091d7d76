package com.frosted.tracer.syntax.node;

import java.util.List;

/**
 * C-style counted loop: {@code for (init; condition; update) body}. Every part but the body is optional.
 */
public final class ForNode extends Node {
    private final int init;
    private final int condition;
    private final int update;
    private final int body;

    public ForNode(int id, Span span, int init, int condition, int update, int body) {
        super(id, span);
        this.init = init;
        this.condition = condition;
        this.update = update;
        this.body = body;
    }

    public int getInit() { return init; }

    public int getCondition() { return condition; }

    public int getUpdate() { return update; }

    public int getBody() { return body; }

    @Override
    public NodeKind kind() { return NodeKind.FOR; }

    @Override
    public List<Integer> children() { return ids(init, condition, update, body); }
}
