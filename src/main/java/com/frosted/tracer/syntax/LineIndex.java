package com.frosted.tracer.syntax;

import com.frosted.tracer.syntax.node.Span;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Line number to the ids of every node whose range includes that line. Built at the end of the parse,
 * read-only afterwards.
 */
public final class LineIndex {
    private final List<List<Integer>> byLine;

    private LineIndex(List<List<Integer>> byLine) {
        this.byLine = byLine;
    }

    public int lineCount() {
        return byLine.size();
    }

    public boolean covers(int line) {
        return line >= 1 && line <= byLine.size() && !byLine.get(line - 1).isEmpty();
    }

    /**
     * Node ids on the given line in ascending id order (innermost nodes first, since children are
     * created before their parents). Empty for lines outside the source.
     */
    public List<Integer> nodesAt(int line) {
        if (line < 1 || line > byLine.size()) {
            return List.of();
        }
        return byLine.get(line - 1);
    }

    static final class Builder {
        private final List<List<Integer>> byLine;

        Builder(int lineCount) {
            byLine = new ArrayList<>(lineCount);
            for (int i = 0; i < lineCount; i++) {
                byLine.add(new ArrayList<>());
            }
        }

        void register(int id, Span span) {
            int from = Math.max(1, span.getStartLine());
            int to = Math.min(byLine.size(), span.getEndLine());
            for (int line = from; line <= to; line++) {
                byLine.get(line - 1).add(id);
            }
        }

        LineIndex build() {
            List<List<Integer>> frozen = new ArrayList<>(byLine.size());
            for (List<Integer> ids : byLine) {
                frozen.add(Collections.unmodifiableList(new ArrayList<>(ids)));
            }
            return new LineIndex(Collections.unmodifiableList(frozen));
        }
    }
}
