package com.frosted.tracer.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The active call frame at a step: function name, its locals, the line it returns to and how
 * many calls of the same function were already active beneath it (0 for a first call).
 */
public final class FrameSnapshot {
    private final String functionName;
    private final Map<String, VariableSnapshot> locals;
    private final int returnLine;
    private final int recursionLevel;

    public FrameSnapshot(String functionName, Map<String, VariableSnapshot> locals, int returnLine,
                         int recursionLevel) {
        this.functionName = functionName;
        this.locals = Collections.unmodifiableMap(new LinkedHashMap<>(locals));
        this.returnLine = returnLine;
        this.recursionLevel = recursionLevel;
    }

    public String getFunctionName() { return functionName; }

    public Map<String, VariableSnapshot> getLocals() { return locals; }

    public int getReturnLine() { return returnLine; }

    public int getRecursionLevel() { return recursionLevel; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FrameSnapshot)) return false;
        FrameSnapshot that = (FrameSnapshot) o;
        return returnLine == that.returnLine && recursionLevel == that.recursionLevel
                && functionName.equals(that.functionName) && locals.equals(that.locals);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functionName, locals, returnLine, recursionLevel);
    }
}
