package com.frosted.tracer.syntax.node;

import java.util.List;

/**
 * {@code for x in xs}, {@code for (const x of xs)}, {@code for (int x : xs)}.
 */
public final class ForEachNode extends Node {
    private final String variable;
    private final String declaredType;
    private final int iterable;
    private final int body;

    public ForEachNode(int id, Span span, String variable, String declaredType, int iterable, int body) {
        super(id, span);
        this.variable = variable;
        this.declaredType = declaredType;
        this.iterable = iterable;
        this.body = body;
    }

    public String getVariable() { return variable; }

    public String getDeclaredType() { return declaredType; }

    public int getIterable() { return iterable; }

    public int getBody() { return body; }

    @Override
    public NodeKind kind() { return NodeKind.FOR_EACH; }

    @Override
    public List<Integer> children() { return ids(iterable, body); }
}
