package com.frosted.tracer.syntax.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node of the syntax tree arena. Nodes refer to their children by arena id; {@link #NONE}
 * marks an absent optional child.
 */
public abstract class Node {
    public static final int NONE = -1;

    private final int id;
    private final Span span;

    protected Node(int id, Span span) {
        this.id = id;
        this.span = span;
    }

    public int getId() { return id; }

    public Span getSpan() { return span; }

    public int getStartLine() { return span.getStartLine(); }

    public int getEndLine() { return span.getEndLine(); }

    public int getColumn() { return span.getColumn(); }

    public abstract NodeKind kind();

    /**
     * Child ids in source order.
     */
    public abstract List<Integer> children();

    protected static List<Integer> ids(int... ids) {
        List<Integer> out = new ArrayList<>(ids.length);
        for (int id : ids) {
            if (id != NONE) out.add(id);
        }
        return Collections.unmodifiableList(out);
    }

    protected static List<Integer> copy(List<Integer> ids) {
        return Collections.unmodifiableList(new ArrayList<>(ids));
    }

    @Override
    public String toString() {
        return kind() + "#" + id + "@" + span;
    }
}
