package com.frosted.tracer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered, immutable sequence of steps. Step numbers run 0, 1, 2, ... without gaps.
 */
public final class ExecutionTrace {
    private final List<Step> steps;

    public ExecutionTrace(List<Step> steps) {
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i).getNumber() != i) {
                throw new IllegalArgumentException("Step " + i + " is numbered " + steps.get(i).getNumber());
            }
        }
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
    }

    public static ExecutionTrace empty() {
        return new ExecutionTrace(List.of());
    }

    public List<Step> getSteps() { return steps; }

    public int size() {
        return steps.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return steps.isEmpty();
    }

    public Step step(int number) {
        return steps.get(number);
    }

    /**
     * Everything the program printed, in order.
     */
    public String getOutput() {
        StringBuilder sb = new StringBuilder();
        for (Step step : steps) {
            if (step.getOutput() != null) sb.append(step.getOutput());
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ExecutionTrace && steps.equals(((ExecutionTrace) o).steps));
    }

    @Override
    public int hashCode() {
        return steps.hashCode();
    }
}
