package com.frosted.tracer.model;

import java.util.Objects;

/**
 * Terminal outcome of a simulation that did not complete.
 */
public final class RuntimeFault {
    private final FaultKind kind;
    private final int line;
    private final String message;

    public RuntimeFault(FaultKind kind, int line, String message) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.line = line;
        this.message = message != null ? message : "";
    }

    public FaultKind getKind() { return kind; }

    public int getLine() { return line; }

    public String getMessage() { return message; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RuntimeFault)) return false;
        RuntimeFault that = (RuntimeFault) o;
        return line == that.line && kind == that.kind && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, line, message);
    }

    @Override
    public String toString() {
        return kind + " at line " + line + ": " + message;
    }
}
