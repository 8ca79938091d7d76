package com.frosted.tracer.syntax;

import com.frosted.tracer.model.StaticError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Best-effort tree, its line index and the syntax errors met on the way.
 */
public final class ParseResult {
    private final SyntaxTree tree;
    private final List<StaticError> errors;

    public ParseResult(SyntaxTree tree, List<StaticError> errors) {
        this.tree = tree;
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public SyntaxTree getTree() { return tree; }

    public LineIndex getLineIndex() { return tree.getLineIndex(); }

    public List<StaticError> getErrors() { return errors; }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
