package com.frosted.tracer.simulation;

import com.frosted.tracer.model.FaultKind;
import com.frosted.tracer.model.RuntimeFault;

/**
 * Ends a simulation run. Carries the fault that becomes part of the result.
 */
public class SimulationFault extends RuntimeException {
    private final RuntimeFault fault;

    public SimulationFault(FaultKind kind, int line, String message) {
        super(message, null, false, false);
        this.fault = new RuntimeFault(kind, line, message);
    }

    public RuntimeFault getFault() {
        return fault;
    }
}
