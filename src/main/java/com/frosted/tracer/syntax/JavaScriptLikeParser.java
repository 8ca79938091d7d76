package com.frosted.tracer.syntax;

import com.frosted.tracer.model.ErrorKind;
import com.frosted.tracer.model.Language;
import com.frosted.tracer.model.SourceText;
import com.frosted.tracer.syntax.node.ForEachNode;
import com.frosted.tracer.syntax.node.FunctionDeclNode;
import com.frosted.tracer.syntax.node.Node;
import com.frosted.tracer.syntax.node.Span;
import com.frosted.tracer.syntax.node.VariableDeclNode;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parser for script-style code: {@code let/const/var}, {@code function}, C-style and
 * {@code for...of} loops, with semicolons optional at line ends.
 */
public final class JavaScriptLikeParser extends CurlyBraceParser {
    private static final Map<String, String> UNSUPPORTED = new HashMap<>();
    private static final Set<String> RESERVED = Set.of(
            "if", "else", "while", "for", "return", "break", "continue", "let", "const", "var",
            "class", "import", "export", "try", "catch", "finally", "throw", "switch", "case",
            "do", "in", "of", "instanceof", "typeof", "delete", "void", "yield", "await");

    static {
        UNSUPPORTED.put("import", "import statement");
        UNSUPPORTED.put("export", "export statement");
        UNSUPPORTED.put("class", "class definition");
        UNSUPPORTED.put("try", "exception handling");
        UNSUPPORTED.put("catch", "exception handling");
        UNSUPPORTED.put("finally", "exception handling");
        UNSUPPORTED.put("throw", "exception handling");
        UNSUPPORTED.put("switch", "switch statement");
        UNSUPPORTED.put("do", "do-while loop");
        UNSUPPORTED.put("async", "async code");
        UNSUPPORTED.put("await", "async code");
        UNSUPPORTED.put("yield", "generator");
        UNSUPPORTED.put("with", "with statement");
        UNSUPPORTED.put("delete", "delete statement");
        UNSUPPORTED.put("debugger", "debugger statement");
    }

    public JavaScriptLikeParser(SourceText source, List<Token> tokens, ErrorSink errors) {
        super(source, Language.JAVASCRIPT_LIKE, tokens, errors);
    }

    @Override
    protected boolean allowsMissingSemicolon() {
        return true;
    }

    @Override
    protected String unsupportedConstruct(Token token) {
        if (peek(1).is("=")) {
            return null;
        }
        return UNSUPPORTED.get(token.getText());
    }

    @Override
    protected LiteralKeyword literalKeyword(String name) {
        switch (name) {
            case "true": return LiteralKeyword.TRUE;
            case "false": return LiteralKeyword.FALSE;
            case "null":
            case "undefined":
                return LiteralKeyword.NONE;
            default: return null;
        }
    }

    @Override
    protected boolean isReserved(String name) {
        return RESERVED.contains(name);
    }

    @Override
    protected int primaryHook(Token token) {
        if (token.is("function")) {
            advance();
            if (checkType(TokenType.NAME)) advance();
            if (match("(")) skipPast(")");
            if (match("{")) skipPast("}");
            return unsupported(token, "function expression");
        }
        if (token.is("new")) {
            advance();
            skipType();
            if (match("(")) skipPast(")");
            return unsupported(token, "object creation with new");
        }
        if (token.is("typeof")) {
            advance();
            parseUnary();
            return unsupported(token, "typeof");
        }
        return Node.NONE;
    }

    @Override
    protected boolean parseDeclaration(List<Integer> out) {
        Token token = peek();
        if (token.is("function") && peek(1).is(TokenType.NAME)) {
            out.add(parseFunction());
            return true;
        }
        if (token.is("let") || token.is("const") || token.is("var")) {
            Token start = advance();
            do {
                int declaration = parseDeclarator(start);
                if (declaration == Node.NONE) {
                    synchronize();
                    return true;
                }
                out.add(declaration);
            } while (match(","));
            endStatement();
            return true;
        }
        return false;
    }

    /** One {@code name = value} after a declaration keyword. */
    private int parseDeclarator(Token keyword) {
        final Token name = peek();
        if (!name.is(TokenType.NAME) || isReserved(name.getText())) {
            if (check("[") || check("{")) {
                advance();
                skipPast(closerFor(name.getText()));
                if (match("=")) parseExpression();
                return unsupported(keyword, "destructuring");
            }
            error(name, ErrorKind.UNEXPECTED_TOKEN, "Expected a variable name after '" + keyword.getText() + "'",
                    "Write " + keyword.getText() + " name = value");
            return Node.NONE;
        }
        advance();
        final boolean constant = keyword.is("const");
        int value = Node.NONE;
        if (match("=")) {
            value = parseExpression();
        } else if (constant) {
            errorAfterPrevious(ErrorKind.MISSING_DELIMITER, "A const needs a value",
                    "Write const " + name.getText() + " = value");
        }
        final int initializer = value;
        final Span span = spanFrom(keyword);
        return tree.add(id -> new VariableDeclNode(id, span, name.getText(), null, initializer, constant)).getId();
    }

    private int parseFunction() {
        final Token start = advance();
        final Token name = advance();
        if (!match("(")) {
            errorAfterPrevious(ErrorKind.MISSING_DELIMITER, "Expected '(' after the function name",
                    "Write function " + name.getText() + "(...) { ... }");
            synchronize();
            if (check("{")) {
                advance();
                skipPast("}");
            }
            return errorNode(start, "malformed function");
        }
        final List<String> parameters = parseParameters(null);
        final int body = parseBracedBlock(start);
        if (parameters == null) {
            return unsupported(start, "default or rest parameters");
        }
        final Span span = spanFrom(start);
        return tree.add(id -> new FunctionDeclNode(id, span, name.getText(), parameters, List.of(), null, body)).getId();
    }

    @Override
    protected boolean isForEachHeader() {
        int offset = check("let") || check("const") || check("var") ? 1 : 0;
        return peek(offset).is(TokenType.NAME) && (peek(offset + 1).is("of") || peek(offset + 1).is("in"));
    }

    @Override
    protected int parseForEach(final Token start) {
        if (check("let") || check("const") || check("var")) {
            advance();
        }
        final Token variable = advance();
        if (advance().is("in")) {
            parseExpression();
            finishForEachHeader(start);
            return unsupported(start, "for...in loop");
        }
        final int iterable = parseExpression();
        final int body = finishForEachHeader(start);
        final Span span = spanFrom(start);
        return tree.add(id -> new ForEachNode(id, span, variable.getText(), null, iterable, body)).getId();
    }

    @Override
    protected int parseForInit() {
        if (check("let") || check("const") || check("var")) {
            Token keyword = advance();
            int declaration = parseDeclarator(keyword);
            if (check(",")) {
                while (match(",")) {
                    parseDeclarator(keyword);
                }
                return unsupported(keyword, "several loop variables");
            }
            return declaration;
        }
        return parseSimpleStatement(peek());
    }
}
