package com.frosted.tracer.syntax.node;

public enum NodeKind {
    PROGRAM,
    BLOCK,
    FUNCTION_DECL,
    VARIABLE_DECL,
    ASSIGNMENT,
    IF,
    WHILE,
    FOR,
    FOR_EACH,
    EXPRESSION_STATEMENT,
    EXPRESSION_CALL,
    RETURN,
    BREAK,
    CONTINUE,
    PASS,
    BINARY_OP,
    UNARY_OP,
    LITERAL,
    IDENTIFIER,
    LIST_LITERAL,
    NEW_ARRAY,
    INDEX_ACCESS,
    MEMBER_ACCESS,
    UNSUPPORTED,
    ERROR
}
