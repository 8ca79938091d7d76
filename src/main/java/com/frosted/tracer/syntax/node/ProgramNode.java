package com.frosted.tracer.syntax.node;

import java.util.List;

public final class ProgramNode extends Node {
    private final List<Integer> statements;

    public ProgramNode(int id, Span span, List<Integer> statements) {
        super(id, span);
        this.statements = copy(statements);
    }

    public List<Integer> getStatements() { return statements; }

    @Override
    public NodeKind kind() { return NodeKind.PROGRAM; }

    @Override
    public List<Integer> children() { return statements; }
}
