package com.frosted.tracer.syntax.node;

import java.util.List;

public final class VariableDeclNode extends Node {
    private final String name;
    private final String declaredType;
    private final int initializer;
    private final boolean constant;

    public VariableDeclNode(int id, Span span, String name, String declaredType, int initializer, boolean constant) {
        super(id, span);
        this.name = name;
        this.declaredType = declaredType;
        this.initializer = initializer;
        this.constant = constant;
    }

    public String getName() { return name; }

    /** Declared type for typed languages, otherwise {@code null}. */
    public String getDeclaredType() { return declaredType; }

    public int getInitializer() { return initializer; }

    public boolean hasInitializer() {
        return initializer != NONE;
    }

    public boolean isConstant() { return constant; }

    @Override
    public NodeKind kind() { return NodeKind.VARIABLE_DECL; }

    @Override
    public List<Integer> children() { return ids(initializer); }
}
