package com.frosted.tracer.syntax;

/**
 * A lexical token. String tokens carry their decoded contents. Synthetic tokens were inserted
 * by the lexer to repair unbalanced brackets and have no source text of their own.
 */
public final class Token {
    private final TokenType type;
    private final String text;
    private final int line;
    private final int column;
    private final boolean synthetic;

    public Token(TokenType type, String text, int line, int column, boolean synthetic) {
        this.type = type;
        this.text = text;
        this.line = line;
        this.column = column;
        this.synthetic = synthetic;
    }

    public Token(TokenType type, String text, int line, int column) {
        this(type, text, line, column, false);
    }

    public TokenType getType() { return type; }

    public String getText() { return text; }

    public int getLine() { return line; }

    public int getColumn() { return column; }

    public boolean isSynthetic() { return synthetic; }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    /** Operator or name with exactly this text; string literals never match. */
    public boolean is(String text) {
        return (type == TokenType.OPERATOR || type == TokenType.NAME) && this.text.equals(text);
    }

    public boolean isLayout() {
        return type == TokenType.NEWLINE || type == TokenType.INDENT || type == TokenType.DEDENT;
    }

    /** How the token reads in an error message. */
    public String describe() {
        switch (type) {
            case NEWLINE: return "end of line";
            case INDENT: return "indentation";
            case DEDENT: return "end of block";
            case EOF: return "end of input";
            case STRING: return "string \"" + text + "\"";
            default: return "'" + text + "'";
        }
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + line + ":" + column;
    }
}
