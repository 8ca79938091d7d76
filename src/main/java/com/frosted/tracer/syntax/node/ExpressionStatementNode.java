package com.frosted.tracer.syntax.node;

import java.util.List;

public final class ExpressionStatementNode extends Node {
    private final int expression;

    public ExpressionStatementNode(int id, Span span, int expression) {
        super(id, span);
        this.expression = expression;
    }

    public int getExpression() { return expression; }

    @Override
    public NodeKind kind() { return NodeKind.EXPRESSION_STATEMENT; }

    @Override
    public List<Integer> children() { return ids(expression); }
}
