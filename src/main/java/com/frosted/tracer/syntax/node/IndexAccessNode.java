package com.frosted.tracer.syntax.node;

import java.util.List;

public final class IndexAccessNode extends Node {
    private final int target;
    private final int index;

    public IndexAccessNode(int id, Span span, int target, int index) {
        super(id, span);
        this.target = target;
        this.index = index;
    }

    public int getTarget() { return target; }

    public int getIndex() { return index; }

    @Override
    public NodeKind kind() { return NodeKind.INDEX_ACCESS; }

    @Override
    public List<Integer> children() { return ids(target, index); }
}
