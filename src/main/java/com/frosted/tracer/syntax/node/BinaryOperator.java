package com.frosted.tracer.syntax.node;

public enum BinaryOperator {
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    FLOOR_DIVIDE("//"),
    MODULO("%"),
    POWER("**"),
    EQUAL("=="),
    NOT_EQUAL("!="),
    STRICT_EQUAL("==="),
    STRICT_NOT_EQUAL("!=="),
    LESS("<"),
    LESS_EQUAL("<="),
    GREATER(">"),
    GREATER_EQUAL(">="),
    AND("and"),
    OR("or"),
    IN("in"),
    NOT_IN("not in");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() { return symbol; }

    public boolean isComparison() {
        switch (this) {
            case EQUAL: case NOT_EQUAL: case STRICT_EQUAL: case STRICT_NOT_EQUAL:
            case LESS: case LESS_EQUAL: case GREATER: case GREATER_EQUAL:
            case IN: case NOT_IN:
                return true;
            default:
                return false;
        }
    }

    public boolean isLogical() {
        return this == AND || this == OR;
    }

    /**
     * Operator of a compound assignment such as {@code +=}, or {@code null} for anything else.
     */
    public static BinaryOperator forCompoundAssignment(String token) {
        switch (token) {
            case "+=": return ADD;
            case "-=": return SUBTRACT;
            case "*=": return MULTIPLY;
            case "/=": return DIVIDE;
            case "//=": return FLOOR_DIVIDE;
            case "%=": return MODULO;
            case "**=": return POWER;
            default: return null;
        }
    }
}
