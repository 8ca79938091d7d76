package com.frosted.tracer.model;

import java.util.Objects;

/**
 * Printable state of one variable at one step.
 */
public final class VariableSnapshot {
    private final String type;
    private final String value;
    private final boolean changed;

    public VariableSnapshot(String type, String value, boolean changed) {
        this.type = type;
        this.value = value;
        this.changed = changed;
    }

    public String getType() { return type; }

    public String getValue() { return value; }

    public boolean isChanged() { return changed; }

    /**
     * True when type and printable value match, regardless of the changed flag.
     */
    public boolean sameState(VariableSnapshot other) {
        return other != null && type.equals(other.type) && value.equals(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VariableSnapshot)) return false;
        VariableSnapshot that = (VariableSnapshot) o;
        return changed == that.changed && type.equals(that.type) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value, changed);
    }

    @Override
    public String toString() {
        return type + " " + value + (changed ? " *" : "");
    }
}
