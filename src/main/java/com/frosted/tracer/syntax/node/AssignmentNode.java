package com.frosted.tracer.syntax.node;

import java.util.List;

/**
 * {@code target = value}, or a compound form such as {@code target += value} when
 * {@link #getCompoundOperator()} is set. {@code i++} is parsed as {@code i += 1}.
 */
public final class AssignmentNode extends Node {
    private final int target;
    private final BinaryOperator compoundOperator;
    private final int value;

    public AssignmentNode(int id, Span span, int target, BinaryOperator compoundOperator, int value) {
        super(id, span);
        this.target = target;
        this.compoundOperator = compoundOperator;
        this.value = value;
    }

    public int getTarget() { return target; }

    public BinaryOperator getCompoundOperator() { return compoundOperator; }

    public int getValue() { return value; }

    @Override
    public NodeKind kind() { return NodeKind.ASSIGNMENT; }

    @Override
    public List<Integer> children() { return ids(target, value); }
}
