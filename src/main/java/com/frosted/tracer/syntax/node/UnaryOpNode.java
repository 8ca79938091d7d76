package com.frosted.tracer.syntax.node;

import java.util.List;

public final class UnaryOpNode extends Node {
    private final UnaryOperator operator;
    private final int operand;

    public UnaryOpNode(int id, Span span, UnaryOperator operator, int operand) {
        super(id, span);
        this.operator = operator;
        this.operand = operand;
    }

    public UnaryOperator getOperator() { return operator; }

    public int getOperand() { return operand; }

    @Override
    public NodeKind kind() { return NodeKind.UNARY_OP; }

    @Override
    public List<Integer> children() { return ids(operand); }
}
