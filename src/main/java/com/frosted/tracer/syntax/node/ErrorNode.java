package com.frosted.tracer.syntax.node;

import java.util.List;

/**
 * Placeholder for a fragment the parser could not make sense of. Always accompanied by a syntax error.
 */
public final class ErrorNode extends Node {
    private final String reason;

    public ErrorNode(int id, Span span, String reason) {
        super(id, span);
        this.reason = reason;
    }

    public String getReason() { return reason; }

    @Override
    public NodeKind kind() { return NodeKind.ERROR; }

    @Override
    public List<Integer> children() { return List.of(); }
}
