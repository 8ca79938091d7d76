package com.frosted.tracer.syntax.node;

import java.util.List;

/**
 * A construct outside the beginner subset (imports, classes, exception handling, ...).
 * Parsed only far enough to skip it; the simulator refuses trees that contain one.
 */
public final class UnsupportedNode extends Node {
    private final String construct;

    public UnsupportedNode(int id, Span span, String construct) {
        super(id, span);
        this.construct = construct;
    }

    public String getConstruct() { return construct; }

    @Override
    public NodeKind kind() { return NodeKind.UNSUPPORTED; }

    @Override
    public List<Integer> children() { return List.of(); }
}
