package com.frosted.tracer.simulation;

/**
 * The absent value: {@code None} in Python-like code, {@code null}/{@code undefined} in the
 * brace languages.
 */
public final class NoneValue {
    public static final NoneValue NONE = new NoneValue();

    private NoneValue() {
    }

    @Override
    public String toString() {
        return "None";
    }
}
