package com.frosted.tracer.check;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Names declared in one lexical scope, remembering which of them are constants.
 */
final class Scope {
    private final Map<String, Boolean> names = new LinkedHashMap<>();
    private final boolean function;

    Scope(boolean function) {
        this.function = function;
    }

    boolean isFunction() {
        return function;
    }

    void declare(String name, boolean constant) {
        names.put(name, constant);
    }

    boolean declares(String name) {
        return names.containsKey(name);
    }

    boolean isConstant(String name) {
        return Boolean.TRUE.equals(names.get(name));
    }

    Set<String> names() {
        return names.keySet();
    }
}
