package com.frosted.tracer.syntax;

import com.frosted.tracer.model.ErrorKind;
import com.frosted.tracer.model.Language;
import com.frosted.tracer.model.SourceText;
import com.frosted.tracer.syntax.node.ForEachNode;
import com.frosted.tracer.syntax.node.FunctionDeclNode;
import com.frosted.tracer.syntax.node.ListLiteralNode;
import com.frosted.tracer.syntax.node.NewArrayNode;
import com.frosted.tracer.syntax.node.Node;
import com.frosted.tracer.syntax.node.Span;
import com.frosted.tracer.syntax.node.VariableDeclNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parser for statically typed, class-based code. A single top-level class is read as a plain
 * container: its methods become functions and its fields become globals. Bare statements
 * without a class are accepted too.
 */
public final class JavaLikeParser extends CurlyBraceParser {
    private static final Set<String> MODIFIERS = Set.of(
            "public", "private", "protected", "static", "final", "abstract", "synchronized",
            "native", "transient", "volatile", "strictfp");
    private static final Set<String> PRIMITIVES = Set.of(
            "int", "long", "short", "byte", "double", "float", "boolean", "char", "void", "var");
    private static final Set<String> TYPE_DECLARATIONS = Set.of("class", "interface", "enum", "record");
    private static final Map<String, String> UNSUPPORTED = new HashMap<>();
    private static final Set<String> RESERVED = Set.of(
            "if", "else", "while", "for", "return", "break", "continue", "class", "interface",
            "enum", "import", "package", "try", "catch", "finally", "throw", "throws", "switch",
            "case", "do", "instanceof", "public", "private", "protected", "static", "final", "void");

    static {
        UNSUPPORTED.put("import", "import statement");
        UNSUPPORTED.put("package", "package declaration");
        UNSUPPORTED.put("try", "exception handling");
        UNSUPPORTED.put("catch", "exception handling");
        UNSUPPORTED.put("finally", "exception handling");
        UNSUPPORTED.put("throw", "exception handling");
        UNSUPPORTED.put("switch", "switch statement");
        UNSUPPORTED.put("do", "do-while loop");
        UNSUPPORTED.put("assert", "assert statement");
        UNSUPPORTED.put("synchronized", "synchronized block");
        UNSUPPORTED.put("interface", "interface definition");
        UNSUPPORTED.put("enum", "enum definition");
        UNSUPPORTED.put("record", "record definition");
    }

    public JavaLikeParser(SourceText source, List<Token> tokens, ErrorSink errors) {
        super(source, Language.JAVA_LIKE, tokens, errors);
    }

    @Override
    protected void parseTopLevel(List<Integer> out) {
        boolean classSeen = false;
        while (!atEnd()) {
            int before = position();
            int offset = modifierCount();
            if (peek(offset).is("class")) {
                if (classSeen) {
                    out.add(skipTypeDeclaration("second class definition"));
                } else {
                    classSeen = true;
                    parseClassBody(out);
                }
            } else if (isMethodDeclaration(offset)) {
                out.add(parseMethod());
            } else {
                parseStatementWithProgress(out);
            }
            if (position() == before) {
                advance();
            }
        }
    }

    /** Members of the wrapper class; they land directly in the program. */
    private void parseClassBody(List<Integer> out) {
        while (MODIFIERS.contains(peek().getText()) && peek().is(TokenType.NAME)) {
            advance();
        }
        Token classToken = advance();
        Token name = peek();
        if (name.is(TokenType.NAME)) {
            advance();
        }
        while (!check("{") && !atEnd() && !check(";")) {
            advance();
        }
        if (!match("{")) {
            errorAfterPrevious(ErrorKind.MISSING_DELIMITER, "Expected '{' to start the class body",
                    "Add '{' after class " + name.getText());
            return;
        }
        while (!check("}") && !atEnd()) {
            int before = position();
            int offset = modifierCount();
            Token member = peek(offset);
            if (TYPE_DECLARATIONS.contains(member.getText())) {
                out.add(skipTypeDeclaration("nested type"));
            } else if (member.is(name.getText()) && peek(offset + 1).is("(")) {
                out.add(skipTypeDeclaration("constructor"));
            } else if (isMethodDeclaration(offset)) {
                out.add(parseMethod());
            } else if (member.is("{")) {
                Token start = peek();
                advance();
                skipPast("}");
                out.add(unsupported(start, "initializer block"));
            } else {
                parseStatement(out);
            }
            if (position() == before) {
                advance();
            }
        }
        if (!match("}")) {
            error(classToken, ErrorKind.UNMATCHED_BRACKET, "The class body is never closed", "Add '}' at the end");
        }
    }

    /** Skips a declaration with a braced body, such as a nested class or a constructor. */
    private int skipTypeDeclaration(String construct) {
        Token start = peek();
        while (!check("{") && !check(";") && !atEnd()) {
            Token token = advance();
            if (token.is("(")) skipPast(")");
        }
        if (match("{")) {
            skipPast("}");
        } else {
            match(";");
        }
        return unsupported(start, construct);
    }

    private int modifierCount() {
        int offset = 0;
        while (peek(offset).is(TokenType.NAME) && MODIFIERS.contains(peek(offset).getText())) {
            offset++;
        }
        return offset;
    }

    /** {@code type name (} after the given number of modifiers. */
    private boolean isMethodDeclaration(int offset) {
        int next = typeEnd(offset);
        return next > offset && peek(next).is(TokenType.NAME) && peek(next + 1).is("(");
    }

    /**
     * Offset just past a type starting at {@code offset}, or {@code offset} itself when no type
     * starts there.
     */
    private int typeEnd(int offset) {
        Token first = peek(offset);
        if (!first.is(TokenType.NAME) || (RESERVED.contains(first.getText()) && !first.is("void"))) {
            return offset;
        }
        int i = offset + 1;
        while (peek(i).is(".") && peek(i + 1).is(TokenType.NAME)) {
            i += 2;
        }
        if (peek(i).is("<")) {
            int depth = 0;
            do {
                if (peek(i).is("<")) depth++;
                if (peek(i).is(">")) depth--;
                if (peek(i).is(";") || peek(i).is(TokenType.EOF)) return offset;
                i++;
            } while (depth > 0);
        }
        while (peek(i).is("[") && peek(i + 1).is("]")) {
            i += 2;
        }
        return i;
    }

    private int parseMethod() {
        final Token start = peek();
        while (peek().is(TokenType.NAME) && MODIFIERS.contains(peek().getText())) {
            advance();
        }
        final String returnType = skipType();
        final Token name = advance();
        advance();
        final List<String> parameterTypes = new ArrayList<>();
        final List<String> parameters = parseParameters(parameterTypes);
        if (match("throws")) {
            do {
                skipType();
            } while (match(","));
        }
        if (match(";")) {
            return unsupported(start, "abstract method");
        }
        final int body = parseBracedBlock(start);
        if (parameters == null) {
            return unsupported(start, "variable argument list");
        }
        final Span span = spanFrom(start);
        return tree.add(id -> new FunctionDeclNode(id, span, name.getText(), parameters, parameterTypes, returnType, body)).getId();
    }

    @Override
    protected boolean allowsMissingSemicolon() {
        return false;
    }

    @Override
    protected String unsupportedConstruct(Token token) {
        if (token.is("synchronized") && !peek(1).is("(")) {
            return null;
        }
        return UNSUPPORTED.get(token.getText());
    }

    @Override
    protected LiteralKeyword literalKeyword(String name) {
        switch (name) {
            case "true": return LiteralKeyword.TRUE;
            case "false": return LiteralKeyword.FALSE;
            case "null": return LiteralKeyword.NONE;
            default: return null;
        }
    }

    @Override
    protected boolean isReserved(String name) {
        return RESERVED.contains(name);
    }

    @Override
    protected int primaryHook(Token token) {
        if (token.is("new")) {
            return parseNew();
        }
        if (token.is("{")) {
            return parseArrayInitializer();
        }
        if (token.is("(") && isCast()) {
            advance();
            skipType();
            advance();
            parseUnary();
            return unsupported(token, "type cast");
        }
        return Node.NONE;
    }

    /** {@code (int) x}: a primitive or capitalised type in parentheses followed by an operand. */
    private boolean isCast() {
        Token type = peek(1);
        if (!type.is(TokenType.NAME)) {
            return false;
        }
        int end = typeEnd(1);
        if (!peek(end).is(")")) {
            return false;
        }
        Token after = peek(end + 1);
        boolean operand = after.is(TokenType.NAME) || after.is(TokenType.NUMBER) || after.is(TokenType.STRING)
                || after.is("(");
        return operand && (PRIMITIVES.contains(type.getText()) || Character.isUpperCase(type.getText().charAt(0)));
    }

    private int parseNew() {
        final Token start = advance();
        final Token typeToken = peek();
        if (!typeToken.is(TokenType.NAME)) {
            unexpected(typeToken);
            return errorNode(start, "expected a type after new");
        }
        advance();
        while (check(".") && peek(1).is(TokenType.NAME)) {
            advance();
            advance();
        }
        if (check("<")) {
            while (!check(">") && !atEnd() && !check(";")) advance();
            match(">");
        }
        if (check("[")) {
            advance();
            if (match("]")) {
                while (check("[") && peek(1).is("]")) {
                    advance();
                    advance();
                }
                if (check("{")) {
                    return parseArrayInitializer();
                }
                errorAfterPrevious(ErrorKind.MISSING_DELIMITER, "Expected the array size or '{' values",
                        "Write new " + typeToken.getText() + "[size]");
                return errorNode(start, "array without size");
            }
            final int size = parseExpression();
            if (!match("]")) {
                unexpected(peek());
                skipPast("]");
            }
            if (check("[")) {
                while (match("[")) skipPast("]");
                return unsupported(start, "multi-dimensional array");
            }
            final String elementType = typeToken.getText();
            final Span span = spanFrom(start);
            return tree.add(id -> new NewArrayNode(id, span, elementType, size)).getId();
        }
        if (match("(")) {
            skipPast(")");
        }
        if (match("{")) {
            skipPast("}");
        }
        return unsupported(start, "object creation with new");
    }

    /** {@code {1, 2, 3}} as an array value. */
    private int parseArrayInitializer() {
        final Token open = advance();
        final List<Integer> elements = new ArrayList<>();
        while (!check("}") && !atEnd()) {
            elements.add(parseExpression());
            if (!match(",")) {
                break;
            }
        }
        if (!match("}")) {
            unexpected(peek());
            skipPast("}");
        }
        final Span span = spanFrom(open);
        return tree.add(id -> new ListLiteralNode(id, span, elements)).getId();
    }

    @Override
    protected boolean parseDeclaration(List<Integer> out) {
        if (!isDeclarationStart()) {
            return false;
        }
        Token start = peek();
        boolean constant = false;
        while (peek().is(TokenType.NAME) && MODIFIERS.contains(peek().getText())) {
            if (advance().is("final")) constant = true;
        }
        String type = skipType();
        do {
            int declaration = parseDeclarator(start, type, constant);
            if (declaration == Node.NONE) {
                synchronize();
                return true;
            }
            out.add(declaration);
        } while (match(","));
        endStatement();
        return true;
    }

    /** Modifiers, then a type, then a name followed by '=', ';', ',' or '['. */
    private boolean isDeclarationStart() {
        int offset = modifierCount();
        int end = typeEnd(offset);
        if (end == offset) {
            return false;
        }
        Token name = peek(end);
        Token after = peek(end + 1);
        return name.is(TokenType.NAME) && !RESERVED.contains(name.getText())
                && (after.is("=") || after.is(";") || after.is(",") || after.is("[")
                || after.getLine() > name.getLine() || after.is(TokenType.EOF));
    }

    private int parseDeclarator(Token start, String declaredType, final boolean constant) {
        final Token name = peek();
        if (!name.is(TokenType.NAME)) {
            error(name, ErrorKind.UNEXPECTED_TOKEN, "Expected a variable name after the type",
                    "Write " + declaredType + " name = value;");
            return Node.NONE;
        }
        advance();
        String type = declaredType;
        while (check("[") && peek(1).is("]")) {
            advance();
            advance();
            type = type + "[]";
        }
        final int initializer = match("=") ? parseExpression() : Node.NONE;
        final String finalType = type;
        final Span span = spanFrom(start);
        return tree.add(id -> new VariableDeclNode(id, span, name.getText(), finalType, initializer, constant)).getId();
    }

    @Override
    protected boolean isForEachHeader() {
        int depth = 0;
        for (int i = 0; ; i++) {
            Token token = peek(i);
            if (token.is(TokenType.EOF) || token.is(";")) {
                return false;
            }
            if (isOpener(token)) {
                depth++;
            } else if (isCloser(token)) {
                if (depth == 0) return false;
                depth--;
            } else if (depth == 0 && token.is(":")) {
                return true;
            }
        }
    }

    @Override
    protected int parseForEach(final Token start) {
        match("final");
        final String type = skipType();
        final Token variable = peek();
        if (!variable.is(TokenType.NAME)) {
            unexpected(variable);
            skipPast(")");
            parseBody(start);
            return errorNode(start, "malformed for loop");
        }
        advance();
        match(":");
        final int iterable = parseExpression();
        final int body = finishForEachHeader(start);
        final Span span = spanFrom(start);
        return tree.add(id -> new ForEachNode(id, span, variable.getText(), type, iterable, body)).getId();
    }

    @Override
    protected int parseForInit() {
        if (isDeclarationStart()) {
            Token start = peek();
            boolean constant = match("final");
            String type = skipType();
            int declaration = parseDeclarator(start, type, constant);
            if (check(",")) {
                while (match(",")) {
                    parseDeclarator(start, type, constant);
                }
                return unsupported(start, "several loop variables");
            }
            return declaration;
        }
        return parseSimpleStatement(peek());
    }
}
