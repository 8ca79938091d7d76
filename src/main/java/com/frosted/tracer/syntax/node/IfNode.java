package com.frosted.tracer.syntax.node;

import java.util.List;

/**
 * Conditional. {@code elif} / {@code else if} chains are an {@code IfNode} in the else branch.
 */
public final class IfNode extends Node {
    private final int condition;
    private final int thenBranch;
    private final int elseBranch;

    public IfNode(int id, Span span, int condition, int thenBranch, int elseBranch) {
        super(id, span);
        this.condition = condition;
        this.thenBranch = thenBranch;
        this.elseBranch = elseBranch;
    }

    public int getCondition() { return condition; }

    public int getThenBranch() { return thenBranch; }

    public int getElseBranch() { return elseBranch; }

    public boolean hasElse() {
        return elseBranch != NONE;
    }

    @Override
    public NodeKind kind() { return NodeKind.IF; }

    @Override
    public List<Integer> children() { return ids(condition, thenBranch, elseBranch); }
}
