package com.frosted.tracer.syntax;

import com.frosted.tracer.model.ErrorKind;
import com.frosted.tracer.model.Language;
import com.frosted.tracer.model.SourceText;
import com.frosted.tracer.syntax.node.CallNode;
import com.frosted.tracer.syntax.node.ForEachNode;
import com.frosted.tracer.syntax.node.FunctionDeclNode;
import com.frosted.tracer.syntax.node.IfNode;
import com.frosted.tracer.syntax.node.Node;
import com.frosted.tracer.syntax.node.NodeKind;
import com.frosted.tracer.syntax.node.ReturnNode;
import com.frosted.tracer.syntax.node.SimpleStatementNode;
import com.frosted.tracer.syntax.node.Span;
import com.frosted.tracer.syntax.node.WhileNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parser for indentation-delimited code: {@code def}, {@code if/elif/else}, {@code while},
 * {@code for x in ...}, simple statements and one-line bodies.
 */
public final class PythonLikeParser extends Parser {
    private static final Map<String, String> UNSUPPORTED = new HashMap<>();
    private static final Set<String> RESERVED = Set.of(
            "def", "if", "elif", "else", "while", "for", "return", "break", "continue", "pass",
            "class", "import", "from", "try", "except", "finally", "raise", "with", "global",
            "nonlocal", "yield", "del", "assert", "async", "await", "in", "and", "or", "is");

    static {
        UNSUPPORTED.put("import", "import statement");
        UNSUPPORTED.put("from", "import statement");
        UNSUPPORTED.put("class", "class definition");
        UNSUPPORTED.put("try", "exception handling");
        UNSUPPORTED.put("except", "exception handling");
        UNSUPPORTED.put("finally", "exception handling");
        UNSUPPORTED.put("raise", "exception handling");
        UNSUPPORTED.put("with", "with statement");
        UNSUPPORTED.put("global", "global declaration");
        UNSUPPORTED.put("nonlocal", "nonlocal declaration");
        UNSUPPORTED.put("yield", "generator");
        UNSUPPORTED.put("async", "async code");
        UNSUPPORTED.put("await", "async code");
        UNSUPPORTED.put("del", "del statement");
        UNSUPPORTED.put("assert", "assert statement");
        UNSUPPORTED.put("match", "match statement");
    }

    public PythonLikeParser(SourceText source, List<Token> tokens, ErrorSink errors) {
        super(source, Language.PYTHON_LIKE, tokens, errors);
    }

    @Override
    protected void parseTopLevel(List<Integer> out) {
        parseStatements(out, true);
    }

    @Override
    protected LiteralKeyword literalKeyword(String name) {
        switch (name) {
            case "True": return LiteralKeyword.TRUE;
            case "False": return LiteralKeyword.FALSE;
            case "None": return LiteralKeyword.NONE;
            default: return null;
        }
    }

    @Override
    protected boolean isReserved(String name) {
        return RESERVED.contains(name);
    }

    @Override
    protected int primaryHook(Token token) {
        if (token.is("lambda")) {
            advance();
            skipLambda();
            return unsupported(token, "lambda");
        }
        return Node.NONE;
    }

    private void skipLambda() {
        while (!atEnd() && !checkType(TokenType.NEWLINE) && !check(",") && !isCloser(peek())) {
            if (isOpener(peek())) {
                String closer = closerFor(advance().getText());
                skipPast(closer);
            } else {
                advance();
            }
        }
    }

    /**
     * Statements up to the DEDENT closing the current block (left unconsumed), or to the end of
     * input at top level.
     */
    private void parseStatements(List<Integer> out, boolean topLevel) {
        while (!atEnd()) {
            Token token = peek();
            if (token.is(TokenType.NEWLINE)) {
                advance();
                continue;
            }
            if (token.is(TokenType.DEDENT)) {
                if (!topLevel) return;
                advance();
                continue;
            }
            if (token.is(TokenType.INDENT)) {
                error(token, ErrorKind.BAD_INDENTATION, "This line is indented more than the lines around it",
                        "Remove the extra indentation");
                advance();
                parseStatements(out, false);
                if (checkType(TokenType.DEDENT)) advance();
                continue;
            }
            int before = position();
            int statement = parseStatement();
            if (statement != Node.NONE) {
                out.add(statement);
            }
            if (position() == before) {
                advance();
            }
        }
    }

    private int parseStatement() {
        Token token = peek();
        if (token.is(TokenType.NAME)) {
            switch (token.getText()) {
                case "def": return parseFunction();
                case "if": return parseIf();
                case "while": return parseWhile();
                case "for": return parseFor();
                case "return": return parseReturn();
                case "break": return parseKeywordStatement(NodeKind.BREAK);
                case "continue": return parseKeywordStatement(NodeKind.CONTINUE);
                case "pass": return parseKeywordStatement(NodeKind.PASS);
                case "elif":
                case "else":
                    error(token, ErrorKind.UNEXPECTED_TOKEN, "'" + token.getText() + "' without a matching 'if'",
                            "Line it up with its 'if', or add the missing 'if'");
                    advance();
                    skipLineAndBlock();
                    return Node.NONE;
                default:
                    break;
            }
            String construct = UNSUPPORTED.get(token.getText());
            if (construct != null && !peek(1).is("=") && !peek(1).is("(")) {
                advance();
                skipLineAndBlock();
                return unsupported(token, construct);
            }
        }
        return parseSimpleLine();
    }

    private int parseFunction() {
        final Token start = advance();
        final Token name = peek();
        if (!name.is(TokenType.NAME) || isReserved(name.getText())) {
            error(name, ErrorKind.UNEXPECTED_TOKEN, "Expected a function name after 'def'",
                    "Write def name(parameters):");
            skipLineAndBlock();
            return errorNode(start, "malformed function");
        }
        advance();
        if (!match("(")) {
            errorAfterPrevious(ErrorKind.MISSING_DELIMITER, "Expected '(' after the function name",
                    "Write def " + name.getText() + "(...):");
            skipLineAndBlock();
            return errorNode(start, "malformed function");
        }
        final List<String> parameters = new ArrayList<>();
        String refused = null;
        while (!check(")") && !atEnd() && !checkType(TokenType.NEWLINE)) {
            if (check("*") || check("**")) {
                advance();
                refused = "variable argument list";
                continue;
            }
            Token parameter = peek();
            if (!parameter.is(TokenType.NAME)) {
                unexpected(parameter);
                skipPast(")");
                break;
            }
            advance();
            parameters.add(parameter.getText());
            if (match(":")) {
                parseExpression();
            }
            if (match("=")) {
                parseExpression();
                refused = "default parameter values";
            }
            if (!match(",")) break;
        }
        if (!match(")") && !previous().is(")")) {
            unexpected(peek());
            skipPast(")");
        }
        if (match("->")) {
            parseExpression();
        }
        final int body = parseBlock(start);
        if (refused != null) {
            return unsupported(start, refused);
        }
        final Span span = spanFrom(start);
        return tree.add(id -> new FunctionDeclNode(id, span, name.getText(), parameters, List.of(), null, body)).getId();
    }

    /**
     * The ':' and body of a compound statement. A missing ':' is reported and the body is still
     * parsed; the block remembers it was not delimited.
     */
    private int parseBlock(Token header) {
        boolean delimited = true;
        if (!match(":")) {
            if (!checkType(TokenType.NEWLINE)) {
                unexpected(peek());
                while (!atEnd() && !checkType(TokenType.NEWLINE) && !check(":")) advance();
            }
            if (!match(":")) {
                errorAfterPrevious(ErrorKind.MISSING_DELIMITER,
                        "Expected ':' at the end of the '" + header.getText() + "' line",
                        "Add ':' at the end of the line");
                delimited = false;
            }
        }
        List<Integer> statements = new ArrayList<>();
        if (checkType(TokenType.NEWLINE)) {
            advance();
            if (checkType(TokenType.INDENT)) {
                Token indent = advance();
                if (enterNested(indent)) {
                    try {
                        parseStatements(statements, false);
                    } finally {
                        exitNested();
                    }
                } else {
                    skipToDedent();
                }
                if (checkType(TokenType.DEDENT)) advance();
            } else {
                Token next = peek();
                Token at = next.is(TokenType.EOF) ? header : next;
                error(at, ErrorKind.BAD_INDENTATION,
                        "Expected an indented block after the '" + header.getText() + "' line",
                        "Indent the lines that belong to this block");
            }
        } else if (!atEnd()) {
            int statement = parseStatement();
            if (statement != Node.NONE) statements.add(statement);
        } else {
            error(header, ErrorKind.BAD_INDENTATION,
                    "Expected an indented block after the '" + header.getText() + "' line",
                    "Indent the lines that belong to this block");
        }
        return block(header, statements, delimited);
    }

    private int parseIf() {
        final Token start = advance();
        final int condition = parseCondition();
        final int thenBranch = parseBlock(start);
        int elseBranch = Node.NONE;
        if (check("elif")) {
            elseBranch = parseIf();
        } else if (check("else")) {
            Token elseToken = advance();
            elseBranch = parseBlock(elseToken);
        }
        final int otherwise = elseBranch;
        final Span span = spanFrom(start);
        return tree.add(id -> new IfNode(id, span, condition, thenBranch, otherwise)).getId();
    }

    private int parseWhile() {
        final Token start = advance();
        final int condition = parseCondition();
        final int body = parseBlock(start);
        final Span span = spanFrom(start);
        return tree.add(id -> new WhileNode(id, span, condition, body)).getId();
    }

    private int parseFor() {
        final Token start = advance();
        final Token variable = peek();
        if (!variable.is(TokenType.NAME) || isReserved(variable.getText())) {
            error(variable, ErrorKind.UNEXPECTED_TOKEN, "Expected a loop variable after 'for'",
                    "Write for name in values:");
            skipLineAndBlock();
            return errorNode(start, "malformed for loop");
        }
        advance();
        if (check(",")) {
            skipLineAndBlock();
            return unsupported(start, "tuple unpacking");
        }
        if (!match("in")) {
            errorAfterPrevious(ErrorKind.MISSING_DELIMITER, "Expected 'in' after the loop variable",
                    "Write for " + variable.getText() + " in values:");
            skipLineAndBlock();
            return errorNode(start, "malformed for loop");
        }
        final int iterable = parseExpression();
        final int body = parseBlock(start);
        final Span span = spanFrom(start);
        return tree.add(id -> new ForEachNode(id, span, variable.getText(), null, iterable, body)).getId();
    }

    private int parseReturn() {
        final Token start = advance();
        int value = Node.NONE;
        if (!checkType(TokenType.NEWLINE) && !checkType(TokenType.EOF) && !check(";")) {
            value = parseExpression();
            if (check(",")) {
                skipToLineEnd();
                endLine();
                return unsupported(start, "returning a tuple");
            }
        }
        endLine();
        final int returned = value;
        final Span span = spanFrom(start);
        return tree.add(id -> new ReturnNode(id, span, returned)).getId();
    }

    private int parseKeywordStatement(final NodeKind kind) {
        Token start = advance();
        endLine();
        final Span span = spanFrom(start);
        return tree.add(id -> new SimpleStatementNode(id, span, kind)).getId();
    }

    private int parseSimpleLine() {
        Token start = peek();
        if (start.is("print") && isStatementPrint()) {
            return parseStatementPrint(start);
        }
        int statement = parseSimpleStatement(start);
        if (check(",") || (check("=") && statement != Node.NONE && tree.get(statement).kind() == NodeKind.ASSIGNMENT)) {
            String construct = check(",") ? "tuple assignment" : "chained assignment";
            skipToLineEnd();
            endLine();
            return unsupported(start, construct);
        }
        endLine();
        return statement;
    }

    /** {@code print x}: the name is followed by a value on the same line instead of '('. */
    private boolean isStatementPrint() {
        Token next = peek(1);
        if (next.getLine() != peek().getLine()) return false;
        return next.is(TokenType.STRING) || next.is(TokenType.NUMBER)
                || (next.is(TokenType.NAME) && !isReserved(next.getText()));
    }

    private int parseStatementPrint(final Token start) {
        advance();
        error(start, ErrorKind.MISSING_DELIMITER, "print needs parentheses around what it prints",
                "Write print(...) with parentheses");
        final int callee = identifier(start);
        final List<Integer> arguments = new ArrayList<>();
        do {
            arguments.add(parseExpression());
        } while (match(","));
        endLine();
        final Span span = spanFrom(start);
        int call = tree.add(id -> new CallNode(id, span, callee, arguments)).getId();
        return expressionStatement(start, call);
    }

    /** Ends a simple statement: ';' or NEWLINE, anything else is reported and skipped. */
    private void endLine() {
        if (match(";")) {
            skipIf(TokenType.NEWLINE);
            return;
        }
        if (checkType(TokenType.NEWLINE)) {
            advance();
            return;
        }
        if (atEnd() || checkType(TokenType.DEDENT)) {
            return;
        }
        unexpected(peek());
        skipToLineEnd();
        skipIf(TokenType.NEWLINE);
    }

    private void skipIf(TokenType type) {
        if (checkType(type)) advance();
    }

    private void skipToLineEnd() {
        while (!atEnd() && !checkType(TokenType.NEWLINE)) {
            advance();
        }
    }

    /** Skips the rest of the logical line and the indented block that follows it, if any. */
    private void skipLineAndBlock() {
        skipToLineEnd();
        skipIf(TokenType.NEWLINE);
        if (checkType(TokenType.INDENT)) {
            advance();
            skipToDedent();
            skipIf(TokenType.DEDENT);
        }
    }

    private void skipToDedent() {
        int depth = 0;
        while (!atEnd()) {
            if (checkType(TokenType.INDENT)) {
                depth++;
            } else if (checkType(TokenType.DEDENT)) {
                if (depth == 0) return;
                depth--;
            }
            advance();
        }
    }
}
