package com.frosted.tracer.simulation;

import com.frosted.tracer.syntax.node.FunctionDeclNode;

import java.util.List;

/**
 * A user-defined function as a value.
 */
public final class FunctionValue {
    private final FunctionDeclNode declaration;

    public FunctionValue(FunctionDeclNode declaration) {
        this.declaration = declaration;
    }

    public String getName() {
        return declaration.getName();
    }

    public List<String> getParameters() {
        return declaration.getParameters();
    }

    public FunctionDeclNode getDeclaration() {
        return declaration;
    }

    @Override
    public String toString() {
        return "function " + getName();
    }
}
