package com.frosted.tracer.syntax;

import com.frosted.tracer.model.ErrorKind;
import com.frosted.tracer.model.Language;
import com.frosted.tracer.model.SourceText;
import com.frosted.tracer.syntax.node.ForNode;
import com.frosted.tracer.syntax.node.IfNode;
import com.frosted.tracer.syntax.node.Node;
import com.frosted.tracer.syntax.node.NodeKind;
import com.frosted.tracer.syntax.node.ReturnNode;
import com.frosted.tracer.syntax.node.SimpleStatementNode;
import com.frosted.tracer.syntax.node.Span;
import com.frosted.tracer.syntax.node.WhileNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Statement grammar common to brace-delimited languages. Subclasses add declarations, function
 * syntax and the for-each header.
 */
abstract class CurlyBraceParser extends Parser {

    protected CurlyBraceParser(SourceText source, Language language, List<Token> tokens, ErrorSink errors) {
        super(source, language, tokens, errors);
    }

    /** Whether a missing ';' is accepted when the next statement starts on a later line. */
    protected abstract boolean allowsMissingSemicolon();

    /** Construct name for a keyword the simulator refuses, or {@code null}. */
    protected abstract String unsupportedConstruct(Token token);

    /** Declarations and function definitions; returns false when the statement is neither. */
    protected abstract boolean parseDeclaration(List<Integer> out);

    /** Whether the tokens after a consumed {@code for (} form a for-each header. */
    protected abstract boolean isForEachHeader();

    /** The for-each loop after {@code for (}, including its body. */
    protected abstract int parseForEach(Token start);

    /** The init clause of a C-style for loop. */
    protected abstract int parseForInit();

    @Override
    protected void parseTopLevel(List<Integer> out) {
        while (!atEnd()) {
            parseStatementWithProgress(out);
        }
    }

    protected void parseStatementWithProgress(List<Integer> out) {
        int before = position();
        if (check("}")) {
            unexpected(peek());
            advance();
            return;
        }
        parseStatement(out);
        if (position() == before) {
            advance();
        }
    }

    protected void parseStatement(List<Integer> out) {
        Token token = peek();
        if (token.is(";")) {
            advance();
            return;
        }
        if (token.is("{")) {
            out.add(parseBracedBlock(token));
            return;
        }
        if (token.is(TokenType.NAME)) {
            switch (token.getText()) {
                case "if": out.add(parseIf()); return;
                case "while": out.add(parseWhile()); return;
                case "for": out.add(parseFor()); return;
                case "return": out.add(parseReturn()); return;
                case "break": out.add(parseKeywordStatement(NodeKind.BREAK)); return;
                case "continue": out.add(parseKeywordStatement(NodeKind.CONTINUE)); return;
                case "else":
                    error(token, ErrorKind.UNEXPECTED_TOKEN, "'else' without a matching 'if'",
                            "Put 'else' right after the if's body");
                    advance();
                    if (check("{")) {
                        advance();
                        skipPast("}");
                    }
                    return;
                default:
                    break;
            }
            String construct = unsupportedConstruct(token);
            if (construct != null) {
                advance();
                skipUnsupported();
                out.add(unsupported(token, construct));
                return;
            }
            if (parseDeclaration(out)) {
                return;
            }
        }
        int statement = parseSimpleStatement(token);
        endStatement();
        if (statement != Node.NONE) {
            out.add(statement);
        }
    }

    /**
     * Ends a statement at ';'. Without one the statement may still end at a '}' or before a
     * token on a later line; anything else on the same line is an error.
     */
    protected void endStatement() {
        if (match(";")) {
            return;
        }
        Token next = peek();
        boolean boundary = next.is("}") || atEnd() || next.getLine() > previous().getLine();
        if (boundary) {
            if (!allowsMissingSemicolon()) {
                errorAfterPrevious(ErrorKind.MISSING_DELIMITER, "Missing ';' at the end of the statement",
                        "Add ';' at the end of the line");
            }
            return;
        }
        if (allowsMissingSemicolon()) {
            unexpected(next);
        } else {
            errorAfterPrevious(ErrorKind.MISSING_DELIMITER, "Expected ';' before " + next.describe(),
                    "End the statement with ';'");
        }
        synchronize();
    }

    /** Skips to the next statement boundary: after ';', before '}', or a later line. */
    protected void synchronize() {
        int line = peek().getLine();
        while (!atEnd()) {
            Token token = peek();
            if (token.is(";")) {
                advance();
                return;
            }
            if (token.is("}") || token.getLine() > line) {
                return;
            }
            advance();
            if (isOpener(token)) {
                skipPast(closerFor(token.getText()));
            }
        }
    }

    /**
     * Skips a refused statement whose keyword was consumed: up to ';' or through its braced
     * body, including trailing {@code else/catch/finally/while} parts.
     */
    protected void skipUnsupported() {
        while (!atEnd()) {
            if (check("}")) {
                return;
            }
            Token token = advance();
            if (token.is(";")) {
                return;
            }
            if (token.is("(") || token.is("[")) {
                skipPast(closerFor(token.getText()));
            } else if (token.is("{")) {
                skipPast("}");
                if (!(check("else") || check("catch") || check("finally") || check("while"))) {
                    match(";");
                    return;
                }
            }
        }
    }

    protected int parseBracedBlock(Token header) {
        Token open = peek();
        if (!match("{")) {
            errorAfterPrevious(ErrorKind.MISSING_DELIMITER, "Expected '{' to start the body",
                    "Add '{' before the body and '}' after it");
            return block(header, new ArrayList<Integer>(), false);
        }
        List<Integer> statements = new ArrayList<>();
        if (enterNested(open)) {
            try {
                while (!check("}") && !atEnd()) {
                    parseStatementWithProgress(statements);
                }
            } finally {
                exitNested();
            }
        } else {
            skipPast("}");
            return block(header, statements, true);
        }
        match("}");
        return block(header, statements, true);
    }

    /** A braced body, or a single statement without braces. */
    protected int parseBody(Token header) {
        if (check("{")) {
            return parseBracedBlock(header);
        }
        List<Integer> statements = new ArrayList<>();
        if (!atEnd() && !check("}")) {
            if (enterNested(peek())) {
                try {
                    parseStatement(statements);
                } finally {
                    exitNested();
                }
            }
        }
        return block(header, statements, false);
    }

    protected int parseParenthesizedCondition(Token keyword) {
        boolean open = match("(");
        if (!open) {
            errorAfterPrevious(ErrorKind.MISSING_DELIMITER, "Expected '(' after '" + keyword.getText() + "'",
                    "Wrap the condition in parentheses");
        }
        int condition = parseCondition();
        if (open && !match(")")) {
            unexpected(peek());
            skipPast(")");
        }
        return condition;
    }

    private int parseIf() {
        final Token start = advance();
        final int condition = parseParenthesizedCondition(start);
        final int thenBranch = parseBody(start);
        int elseBranch = Node.NONE;
        if (check("else")) {
            Token elseToken = advance();
            elseBranch = check("if") ? parseIf() : parseBody(elseToken);
        }
        final int otherwise = elseBranch;
        final Span span = spanFrom(start);
        return tree.add(id -> new IfNode(id, span, condition, thenBranch, otherwise)).getId();
    }

    private int parseWhile() {
        final Token start = advance();
        final int condition = parseParenthesizedCondition(start);
        final int body = parseBody(start);
        final Span span = spanFrom(start);
        return tree.add(id -> new WhileNode(id, span, condition, body)).getId();
    }

    private int parseFor() {
        final Token start = advance();
        if (!match("(")) {
            errorAfterPrevious(ErrorKind.MISSING_DELIMITER, "Expected '(' after 'for'",
                    "Write for (start; condition; step)");
            synchronize();
            return errorNode(start, "malformed for loop");
        }
        if (isForEachHeader()) {
            return parseForEach(start);
        }
        final int init = check(";") ? Node.NONE : parseForInit();
        expectForSemicolon("after the loop's starting statement");
        final int condition = check(";") ? Node.NONE : parseCondition();
        expectForSemicolon("after the loop condition");
        final int update = check(")") ? Node.NONE : parseSimpleStatement(peek());
        if (!match(")")) {
            unexpected(peek());
            skipPast(")");
        }
        final int body = parseBody(start);
        final Span span = spanFrom(start);
        return tree.add(id -> new ForNode(id, span, init, condition, update, body)).getId();
    }

    private void expectForSemicolon(String where) {
        if (!match(";")) {
            errorAfterPrevious(ErrorKind.MISSING_DELIMITER, "Expected ';' " + where,
                    "Separate the parts of the for header with ';'");
        }
    }

    /** Closes a for-each header and parses its body. */
    protected int finishForEachHeader(Token start) {
        if (!match(")")) {
            unexpected(peek());
            skipPast(")");
        }
        return parseBody(start);
    }

    private int parseReturn() {
        final Token start = advance();
        int value = Node.NONE;
        Token next = peek();
        if (!next.is(";") && !next.is("}") && !atEnd() && next.getLine() == start.getLine()) {
            value = parseExpression();
        }
        endStatement();
        final int returned = value;
        final Span span = spanFrom(start);
        return tree.add(id -> new ReturnNode(id, span, returned)).getId();
    }

    private int parseKeywordStatement(final NodeKind kind) {
        Token start = advance();
        endStatement();
        final Span span = spanFrom(start);
        return tree.add(id -> new SimpleStatementNode(id, span, kind)).getId();
    }

    /** Parameter names after a consumed '(' through ')'; {@code null} when a parameter is refused. */
    /**
     * Parameter names up to and including ')'. When {@code types} is given, each parameter is
     * read with its type, which is appended there. Returns {@code null} for refused forms
     * (defaults, varargs).
     */
    protected List<String> parseParameters(List<String> types) {
        List<String> parameters = new ArrayList<>();
        boolean refused = false;
        while (!check(")") && !atEnd()) {
            if (match("...")) {
                refused = true;
            }
            if (types != null) {
                match("final");
                types.add(skipType());
            }
            Token name = peek();
            if (!name.is(TokenType.NAME)) {
                unexpected(name);
                skipPast(")");
                return refused ? null : parameters;
            }
            advance();
            parameters.add(name.getText());
            if (match("=")) {
                parseExpression();
                refused = true;
            }
            if (!match(",")) {
                break;
            }
        }
        if (!match(")")) {
            unexpected(peek());
            skipPast(")");
        }
        return refused ? null : parameters;
    }

    /** Consumes a type such as {@code int}, {@code String[]} or {@code List<Integer>}. */
    protected String skipType() {
        StringBuilder type = new StringBuilder();
        if (!checkType(TokenType.NAME)) {
            return type.toString();
        }
        type.append(advance().getText());
        while (check(".") && peek(1).is(TokenType.NAME)) {
            advance();
            type.append('.').append(advance().getText());
        }
        if (check("<")) {
            int depth = 0;
            do {
                Token token = advance();
                if (token.is("<")) depth++;
                if (token.is(">")) depth--;
                type.append(token.getText());
            } while (depth > 0 && !atEnd() && !check(";") && !check("{"));
        }
        while (check("[") && peek(1).is("]")) {
            advance();
            advance();
            type.append("[]");
        }
        if (match("...")) {
            type.append("...");
        }
        return type.toString();
    }
}
