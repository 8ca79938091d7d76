package com.frosted.tracer.syntax;

import com.frosted.tracer.model.Language;
import com.frosted.tracer.model.SourceText;
import com.frosted.tracer.syntax.node.Node;
import com.frosted.tracer.syntax.node.NodeKind;
import com.frosted.tracer.syntax.node.ProgramNode;
import com.frosted.tracer.syntax.node.Span;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.function.IntFunction;

/**
 * Arena of nodes addressed by integer id. The root is a {@link ProgramNode} spanning the whole
 * source. Immutable once built, so it may be read from several threads.
 */
public final class SyntaxTree {
    private final SourceText source;
    private final Language language;
    private final List<Node> nodes;
    private final int rootId;
    private final LineIndex lineIndex;

    private SyntaxTree(SourceText source, Language language, List<Node> nodes, int rootId, LineIndex lineIndex) {
        this.source = source;
        this.language = language;
        this.nodes = Collections.unmodifiableList(nodes);
        this.rootId = rootId;
        this.lineIndex = lineIndex;
    }

    /** A tree holding only an empty Program node. */
    public static SyntaxTree empty(SourceText source, Language language) {
        Builder builder = new Builder(source, language);
        ProgramNode root = builder.add(id -> new ProgramNode(id, new Span(1, source.lineCount(), 1), List.of()));
        return builder.build(root.getId());
    }

    public SourceText getSource() { return source; }

    public Language getLanguage() { return language; }

    public LineIndex getLineIndex() { return lineIndex; }

    public ProgramNode getRoot() {
        return (ProgramNode) nodes.get(rootId);
    }

    public int size() {
        return nodes.size();
    }

    public Node node(int id) {
        return nodes.get(id);
    }

    public <T extends Node> T node(int id, Class<T> type) {
        return type.cast(nodes.get(id));
    }

    public List<Node> children(int id) {
        List<Node> out = new ArrayList<>();
        for (int child : nodes.get(id).children()) {
            out.add(nodes.get(child));
        }
        return out;
    }

    /**
     * Pre-order walk from the root.
     */
    public List<Node> walk() {
        List<Node> out = new ArrayList<>(nodes.size());
        Deque<Integer> pending = new ArrayDeque<>();
        pending.push(rootId);
        while (!pending.isEmpty()) {
            Node node = nodes.get(pending.pop());
            out.add(node);
            List<Integer> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
        return out;
    }

    public <T extends Node> List<T> findAll(Class<T> type) {
        List<T> out = new ArrayList<>();
        for (Node node : walk()) {
            if (type.isInstance(node)) out.add(type.cast(node));
        }
        return out;
    }

    public boolean contains(NodeKind kind) {
        for (Node node : walk()) {
            if (node.kind() == kind) return true;
        }
        return false;
    }

    /**
     * Accumulates nodes during a parse. Statements the parser gave up on stay in the arena but
     * are unreachable from the root and are left out of the line index.
     */
    public static final class Builder {
        private final SourceText source;
        private final Language language;
        private final List<Node> nodes = new ArrayList<>();

        public Builder(SourceText source, Language language) {
            this.source = source;
            this.language = language;
        }

        public <T extends Node> T add(IntFunction<T> factory) {
            int id = nodes.size();
            T node = factory.apply(id);
            if (node.getId() != id) {
                throw new IllegalStateException("Node created with id " + node.getId() + ", expected " + id);
            }
            nodes.add(node);
            return node;
        }

        public Node get(int id) {
            return nodes.get(id);
        }

        public SyntaxTree build(int rootId) {
            LineIndex.Builder index = new LineIndex.Builder(source.lineCount());
            Deque<Integer> pending = new ArrayDeque<>();
            pending.push(rootId);
            List<Integer> reachable = new ArrayList<>();
            while (!pending.isEmpty()) {
                int id = pending.pop();
                reachable.add(id);
                for (int child : nodes.get(id).children()) {
                    pending.push(child);
                }
            }
            Collections.sort(reachable);
            for (int id : reachable) {
                index.register(id, nodes.get(id).getSpan());
            }
            return new SyntaxTree(source, language, new ArrayList<>(nodes), rootId, index.build());
        }
    }
}
