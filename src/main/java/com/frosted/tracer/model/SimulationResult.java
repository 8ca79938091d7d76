package com.frosted.tracer.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Optional;

/**
 * Trace plus the fault that ended it, if any.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SimulationResult {
    private final ExecutionTrace trace;
    private final RuntimeFault fault;

    public SimulationResult(ExecutionTrace trace, RuntimeFault fault) {
        this.trace = trace;
        this.fault = fault;
    }

    public ExecutionTrace getTrace() { return trace; }

    public RuntimeFault getFault() { return fault; }

    public Optional<RuntimeFault> fault() {
        return Optional.ofNullable(fault);
    }

    public boolean isCompletedSuccessfully() {
        return fault == null;
    }
}
