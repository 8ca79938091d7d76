package com.frosted.tracer.syntax.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class FunctionDeclNode extends Node {
    private final String name;
    private final List<String> parameters;
    private final List<String> parameterTypes;
    private final String returnType;
    private final int body;

    /**
     * @param parameterTypes declared parameter types in order, empty for languages without them
     * @param returnType     declared return type, {@code null} for languages without one
     */
    public FunctionDeclNode(int id, Span span, String name, List<String> parameters, List<String> parameterTypes,
                            String returnType, int body) {
        super(id, span);
        this.name = name;
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        this.parameterTypes = Collections.unmodifiableList(new ArrayList<>(parameterTypes));
        this.returnType = returnType;
        this.body = body;
    }

    public String getName() { return name; }

    public List<String> getParameters() { return parameters; }

    /** Declared type of the parameter at {@code index}, or {@code null} when untyped. */
    public String getParameterType(int index) {
        return index < parameterTypes.size() ? parameterTypes.get(index) : null;
    }

    public String getReturnType() { return returnType; }

    public int getBody() { return body; }

    public boolean isVoid() {
        return "void".equals(returnType);
    }

    @Override
    public NodeKind kind() { return NodeKind.FUNCTION_DECL; }

    @Override
    public List<Integer> children() { return ids(body); }
}
