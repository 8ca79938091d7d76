package com.frosted.tracer.simulation;

/**
 * Non-local exits of the simulated program ({@code return}, {@code break}, {@code continue}).
 * Thrown without stack traces; caught by the enclosing call or loop.
 */
abstract class ControlSignal extends RuntimeException {

    ControlSignal() {
        super(null, null, false, false);
    }

    static final class Return extends ControlSignal {
        final Object value;
        final int line;

        Return(Object value, int line) {
            this.value = value;
            this.line = line;
        }
    }

    static final class Break extends ControlSignal {
    }

    static final class Continue extends ControlSignal {
    }
}
