package com.frosted.tracer.syntax.node;

import java.util.List;

public final class MemberAccessNode extends Node {
    private final int target;
    private final String member;

    public MemberAccessNode(int id, Span span, int target, String member) {
        super(id, span);
        this.target = target;
        this.member = member;
    }

    public int getTarget() { return target; }

    public String getMember() { return member; }

    @Override
    public NodeKind kind() { return NodeKind.MEMBER_ACCESS; }

    @Override
    public List<Integer> children() { return ids(target); }
}
