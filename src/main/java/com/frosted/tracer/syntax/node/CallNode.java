package com.frosted.tracer.syntax.node;

import java.util.ArrayList;
import java.util.List;

/**
 * Function or method call. The callee is an identifier or a member access such as {@code console.log}.
 */
public final class CallNode extends Node {
    private final int callee;
    private final List<Integer> arguments;

    public CallNode(int id, Span span, int callee, List<Integer> arguments) {
        super(id, span);
        this.callee = callee;
        this.arguments = copy(arguments);
    }

    public int getCallee() { return callee; }

    public List<Integer> getArguments() { return arguments; }

    @Override
    public NodeKind kind() { return NodeKind.EXPRESSION_CALL; }

    @Override
    public List<Integer> children() {
        List<Integer> out = new ArrayList<>(arguments.size() + 1);
        out.add(callee);
        out.addAll(arguments);
        return out;
    }
}
