package com.frosted.tracer.syntax.node;

import java.util.List;

/**
 * {@code new int[n]}: an array of {@code n} default values.
 */
public final class NewArrayNode extends Node {
    private final String elementType;
    private final int size;

    public NewArrayNode(int id, Span span, String elementType, int size) {
        super(id, span);
        this.elementType = elementType;
        this.size = size;
    }

    public String getElementType() { return elementType; }

    public int getSize() { return size; }

    @Override
    public NodeKind kind() { return NodeKind.NEW_ARRAY; }

    @Override
    public List<Integer> children() { return ids(size); }
}
