package com.frosted.tracer.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Represents a single visible action of the simulated program.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"number", "line", "description", "controlFlow", "variables", "frame", "callStack", "output"})
public final class Step {
    private final int number;
    private final int line;
    private final String description;
    private final Map<String, VariableSnapshot> variables;
    private final ControlFlow controlFlow;
    private final FrameSnapshot frame;
    private final String callStack;
    private final String output;

    public Step(int number, int line, String description, Map<String, VariableSnapshot> variables,
                ControlFlow controlFlow, FrameSnapshot frame, String callStack, String output) {
        this.number = number;
        this.line = line;
        this.description = description != null ? description : "";
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        this.controlFlow = controlFlow;
        this.frame = frame;
        this.callStack = callStack != null ? callStack : "";
        this.output = output;
    }

    public int getNumber() { return number; }

    public int getLine() { return line; }

    public String getDescription() { return description; }

    public Map<String, VariableSnapshot> getVariables() { return variables; }

    public ControlFlow getControlFlow() { return controlFlow; }

    public FrameSnapshot getFrame() { return frame; }

    public String getCallStack() { return callStack; }

    public String getOutput() { return output; }

    /**
     * Looks a name up in the active frame first, then in the globals.
     */
    public VariableSnapshot variable(String name) {
        if (frame != null && frame.getLocals().containsKey(name)) {
            return frame.getLocals().get(name);
        }
        return variables.get(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Step)) return false;
        Step step = (Step) o;
        return number == step.number && line == step.line && description.equals(step.description)
                && variables.equals(step.variables) && Objects.equals(controlFlow, step.controlFlow)
                && Objects.equals(frame, step.frame) && callStack.equals(step.callStack)
                && Objects.equals(output, step.output);
    }

    @Override
    public int hashCode() {
        return Objects.hash(number, line, description, variables, controlFlow, frame, callStack, output);
    }

    @Override
    public String toString() {
        return "#" + number + " line " + line + " " + description + (controlFlow != null ? " [" + controlFlow + "]" : "");
    }
}
