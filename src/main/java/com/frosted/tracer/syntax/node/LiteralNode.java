package com.frosted.tracer.syntax.node;

import java.util.List;

/**
 * A constant. The value is a {@link Long}, {@link Double}, {@link String}, {@link Boolean}
 * or {@code null}, matching {@link #getType()}.
 */
public final class LiteralNode extends Node {

    public enum Type {
        INTEGER,
        FLOAT,
        STRING,
        BOOLEAN,
        NONE
    }

    private final Type type;
    private final Object value;

    private LiteralNode(int id, Span span, Type type, Object value) {
        super(id, span);
        this.type = type;
        this.value = value;
    }

    public static LiteralNode ofInteger(int id, Span span, long value) {
        return new LiteralNode(id, span, Type.INTEGER, value);
    }

    public static LiteralNode ofFloat(int id, Span span, double value) {
        return new LiteralNode(id, span, Type.FLOAT, value);
    }

    public static LiteralNode ofString(int id, Span span, String value) {
        return new LiteralNode(id, span, Type.STRING, value);
    }

    public static LiteralNode ofBoolean(int id, Span span, boolean value) {
        return new LiteralNode(id, span, Type.BOOLEAN, value);
    }

    public static LiteralNode ofNone(int id, Span span) {
        return new LiteralNode(id, span, Type.NONE, null);
    }

    public Type getType() { return type; }

    public Object getValue() { return value; }

    @Override
    public NodeKind kind() { return NodeKind.LITERAL; }

    @Override
    public List<Integer> children() { return List.of(); }
}
