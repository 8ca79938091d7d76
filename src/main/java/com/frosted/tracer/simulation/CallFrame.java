package com.frosted.tracer.simulation;

import com.frosted.tracer.model.VariableSnapshot;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A single frame on the simulated call stack: the function's variables, where it was called
 * from, and the snapshot last shown for it (used to flag changed variables).
 */
final class CallFrame {
    private final String name;
    private final int callLine;
    private final int recursionLevel;
    private final Map<String, Object> locals = new LinkedHashMap<>();
    private final Map<String, String> declaredTypes = new HashMap<>();
    private final Set<String> constants = new HashSet<>();
    private final Deque<List<String>> blockDeclarations = new ArrayDeque<>();
    private Map<String, VariableSnapshot> lastSnapshot = new LinkedHashMap<>();

    CallFrame(String name, int callLine, int recursionLevel) {
        this.name = name;
        this.callLine = callLine;
        this.recursionLevel = recursionLevel;
    }

    String getName() { return name; }

    int getCallLine() { return callLine; }

    int getRecursionLevel() { return recursionLevel; }

    Map<String, Object> getLocals() { return locals; }

    boolean has(String variable) {
        return locals.containsKey(variable);
    }

    Object get(String variable) {
        return locals.get(variable);
    }

    void set(String variable, Object value) {
        locals.put(variable, value);
    }

    /** Binds a new variable, remembering its declared type and the block that declared it. */
    void declare(String variable, Object value, String declaredType, boolean constant) {
        if (!locals.containsKey(variable) && !blockDeclarations.isEmpty()) {
            blockDeclarations.peek().add(variable);
        }
        locals.put(variable, value);
        if (declaredType != null) {
            declaredTypes.put(variable, declaredType);
        }
        if (constant) {
            constants.add(variable);
        } else {
            constants.remove(variable);
        }
    }

    boolean isConstant(String variable) {
        return constants.contains(variable);
    }

    String declaredType(String variable) {
        return declaredTypes.get(variable);
    }

    void enterBlock() {
        blockDeclarations.push(new ArrayList<>());
    }

    /** Drops the variables the innermost block declared. */
    void exitBlock() {
        for (String variable : blockDeclarations.pop()) {
            locals.remove(variable);
            declaredTypes.remove(variable);
            constants.remove(variable);
        }
    }

    Map<String, VariableSnapshot> getLastSnapshot() { return lastSnapshot; }

    void setLastSnapshot(Map<String, VariableSnapshot> snapshot) {
        this.lastSnapshot = snapshot;
    }
}
