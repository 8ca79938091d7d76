package com.frosted.tracer.syntax.node;

import java.util.List;

/**
 * {@code [1, 2, 3]}, or a Java array initializer {@code {1, 2, 3}}.
 */
public final class ListLiteralNode extends Node {
    private final List<Integer> elements;

    public ListLiteralNode(int id, Span span, List<Integer> elements) {
        super(id, span);
        this.elements = copy(elements);
    }

    public List<Integer> getElements() { return elements; }

    @Override
    public NodeKind kind() { return NodeKind.LIST_LITERAL; }

    @Override
    public List<Integer> children() { return elements; }
}
