package com.frosted.tracer.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Control-flow annotation attached to a step.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ControlFlow {

    public enum Kind {
        ENTER_LOOP,
        LOOP_ITERATION,
        EXIT_LOOP,
        BRANCH_TAKEN,
        CALL_ENTER,
        CALL_RETURN
    }

    private final Kind kind;
    private final Integer iteration;
    private final Boolean branch;
    private final String function;

    private ControlFlow(Kind kind, Integer iteration, Boolean branch, String function) {
        this.kind = kind;
        this.iteration = iteration;
        this.branch = branch;
        this.function = function;
    }

    public static ControlFlow enterLoop() {
        return new ControlFlow(Kind.ENTER_LOOP, null, null, null);
    }

    public static ControlFlow loopIteration(int n) {
        return new ControlFlow(Kind.LOOP_ITERATION, n, null, null);
    }

    public static ControlFlow exitLoop() {
        return new ControlFlow(Kind.EXIT_LOOP, null, null, null);
    }

    public static ControlFlow branchTaken(boolean taken) {
        return new ControlFlow(Kind.BRANCH_TAKEN, null, taken, null);
    }

    public static ControlFlow callEnter(String function) {
        return new ControlFlow(Kind.CALL_ENTER, null, null, function);
    }

    public static ControlFlow callReturn(String function) {
        return new ControlFlow(Kind.CALL_RETURN, null, null, function);
    }

    public Kind getKind() { return kind; }

    public Integer getIteration() { return iteration; }

    public Boolean getBranch() { return branch; }

    public String getFunction() { return function; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ControlFlow)) return false;
        ControlFlow that = (ControlFlow) o;
        return kind == that.kind && Objects.equals(iteration, that.iteration)
                && Objects.equals(branch, that.branch) && Objects.equals(function, that.function);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, iteration, branch, function);
    }

    @Override
    public String toString() {
        switch (kind) {
            case LOOP_ITERATION: return "LoopIteration(" + iteration + ")";
            case BRANCH_TAKEN: return "BranchTaken(" + branch + ")";
            case CALL_ENTER: return "CallEnter(" + function + ")";
            case CALL_RETURN: return "CallReturn(" + function + ")";
            case ENTER_LOOP: return "EnterLoop";
            default: return "ExitLoop";
        }
    }
}
