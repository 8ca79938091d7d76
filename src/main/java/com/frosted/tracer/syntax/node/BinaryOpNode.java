package com.frosted.tracer.syntax.node;

import java.util.List;

public final class BinaryOpNode extends Node {
    private final BinaryOperator operator;
    private final int left;
    private final int right;

    public BinaryOpNode(int id, Span span, BinaryOperator operator, int left, int right) {
        super(id, span);
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public BinaryOperator getOperator() { return operator; }

    public int getLeft() { return left; }

    public int getRight() { return right; }

    @Override
    public NodeKind kind() { return NodeKind.BINARY_OP; }

    @Override
    public List<Integer> children() { return ids(left, right); }
}
