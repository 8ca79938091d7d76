package com.frosted.tracer.syntax;

public enum TokenType {
    NAME,
    NUMBER,
    STRING,
    OPERATOR,
    NEWLINE,
    INDENT,
    DEDENT,
    EOF
}
