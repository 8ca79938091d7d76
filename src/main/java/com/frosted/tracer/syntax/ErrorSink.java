package com.frosted.tracer.syntax;

import com.frosted.tracer.model.StaticError;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects syntax errors for one parse. Keeps at most one error per line: after the first
 * problem on a line, whatever follows is usually a consequence of it.
 */
public final class ErrorSink {
    private final List<StaticError> errors = new ArrayList<>();
    private final Set<Integer> lines = new HashSet<>();

    public boolean report(StaticError error) {
        if (!lines.add(error.getLine())) {
            return false;
        }
        errors.add(error);
        return true;
    }

    public boolean hasErrorOn(int line) {
        return lines.contains(line);
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    public List<StaticError> sorted() {
        List<StaticError> out = new ArrayList<>(errors);
        out.sort(StaticError.ORDER);
        return out;
    }
}
