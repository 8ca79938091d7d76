package com.frosted.tracer.syntax;

import com.frosted.tracer.model.ErrorKind;
import com.frosted.tracer.model.Language;
import com.frosted.tracer.model.SourceText;
import com.frosted.tracer.model.StaticError;
import com.frosted.tracer.syntax.node.AssignmentNode;
import com.frosted.tracer.syntax.node.BinaryOpNode;
import com.frosted.tracer.syntax.node.BinaryOperator;
import com.frosted.tracer.syntax.node.BlockNode;
import com.frosted.tracer.syntax.node.CallNode;
import com.frosted.tracer.syntax.node.ErrorNode;
import com.frosted.tracer.syntax.node.ExpressionStatementNode;
import com.frosted.tracer.syntax.node.IdentifierNode;
import com.frosted.tracer.syntax.node.IndexAccessNode;
import com.frosted.tracer.syntax.node.ListLiteralNode;
import com.frosted.tracer.syntax.node.LiteralNode;
import com.frosted.tracer.syntax.node.MemberAccessNode;
import com.frosted.tracer.syntax.node.Node;
import com.frosted.tracer.syntax.node.NodeKind;
import com.frosted.tracer.syntax.node.ProgramNode;
import com.frosted.tracer.syntax.node.Span;
import com.frosted.tracer.syntax.node.UnaryOpNode;
import com.frosted.tracer.syntax.node.UnaryOperator;
import com.frosted.tracer.syntax.node.UnsupportedNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser shared by all languages. Subclasses supply the statement grammar and
 * a few expression hooks; the expression grammar itself is common:
 *
 * <pre>
 * or         := and (("or" | "||") and)*
 * and        := not (("and" | "&amp;&amp;") not)*
 * not        := "not" not | comparison
 * comparison := additive (compare-op additive)*
 * additive   := multiplicative (("+" | "-") multiplicative)*
 * multiplicative := unary (("*" | "/" | "//" | "%") unary)*
 * unary      := ("-" | "+" | "!") unary | power
 * power      := postfix ("**" unary)?
 * postfix    := primary ("(" args ")" | "[" expr "]" | "." name)*
 * </pre>
 *
 * Every error goes to the {@link ErrorSink}; the parser itself never throws on bad input.
 */
public abstract class Parser {
    static final int MAX_NESTING = 200;

    protected final SourceText source;
    protected final Language language;
    protected final ErrorSink errors;
    protected final SyntaxTree.Builder tree;

    private final List<Token> tokens;
    private int pos;
    private int lastLine = 1;
    // furthest line any node has started on, including nodes built on a token left unconsumed
    private int reachedLine = 1;
    private int nesting;

    protected Parser(SourceText source, Language language, List<Token> tokens, ErrorSink errors) {
        this.source = source;
        this.language = language;
        this.tokens = tokens;
        this.errors = errors;
        this.tree = new SyntaxTree.Builder(source, language);
    }

    public final SyntaxTree parseProgram() {
        final List<Integer> statements = new ArrayList<>();
        parseTopLevel(statements);
        ProgramNode root = tree.add(id -> new ProgramNode(id, new Span(1, source.lineCount(), 1), statements));
        return tree.build(root.getId());
    }

    /** Parses statements until end of input, adding the ids of the ones worth keeping. */
    protected abstract void parseTopLevel(List<Integer> out);

    /** Language-specific primary expressions; {@link Node#NONE} falls through to the common ones. */
    protected int primaryHook(Token token) {
        return Node.NONE;
    }

    /** Names that read as literals, or {@code null} when the name is an ordinary identifier. */
    protected abstract LiteralKeyword literalKeyword(String name);

    /** Keywords that cannot start an expression. */
    protected abstract boolean isReserved(String name);

    protected enum LiteralKeyword {
        TRUE,
        FALSE,
        NONE
    }

    // ---- token cursor ----

    protected Token peek() {
        return tokens.get(pos);
    }

    protected Token peek(int ahead) {
        return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
    }

    protected Token previous() {
        return pos > 0 ? tokens.get(pos - 1) : tokens.get(0);
    }

    protected Token advance() {
        Token token = tokens.get(pos);
        if (!token.is(TokenType.EOF)) {
            pos++;
            if (!token.isLayout()) {
                lastLine = Math.max(lastLine, token.getLine());
            }
        }
        return token;
    }

    protected int position() {
        return pos;
    }

    protected boolean check(String text) {
        return peek().is(text);
    }

    protected boolean checkType(TokenType type) {
        return peek().is(type);
    }

    protected boolean match(String text) {
        if (check(text)) {
            advance();
            return true;
        }
        return false;
    }

    protected boolean atEnd() {
        return peek().is(TokenType.EOF);
    }

    /**
     * A span from {@code start} to the furthest line seen so far. Nodes are built after their
     * children, so the span covers every child, even one that starts on an unconsumed token.
     */
    protected Span spanFrom(Token start) {
        return new Span(start.getLine(), endLineFrom(start.getLine()), start.getColumn());
    }

    private int endLineFrom(int startLine) {
        reachedLine = Math.max(reachedLine, startLine);
        return Math.max(lastLine, reachedLine);
    }

    // ---- errors and recovery ----

    protected void error(Token at, ErrorKind kind, String message, String fix) {
        errors.report(StaticError.error(at.getLine(), at.getColumn(), kind, message, fix));
    }

    /** Reports a problem just after the last consumed token, where a missing delimiter belongs. */
    protected void errorAfterPrevious(ErrorKind kind, String message, String fix) {
        Token last = previous();
        int column = last.getColumn() + Math.max(1, last.getText().length());
        errors.report(StaticError.error(last.getLine(), column, kind, message, fix));
    }

    protected void unexpected(Token token) {
        error(token, ErrorKind.UNEXPECTED_TOKEN, "Unexpected " + token.describe(),
                "Check the code around " + token.describe());
    }

    /**
     * Consumes tokens up to and including the closer matching an already consumed opener. Stops
     * early at the end of a logical line in indentation languages.
     */
    protected void skipPast(String closer) {
        int depth = 0;
        while (!atEnd() && !checkType(TokenType.NEWLINE)) {
            Token token = peek();
            if (isOpener(token)) {
                depth++;
            } else if (isCloser(token)) {
                if (depth == 0) {
                    // a different closer belongs to an enclosing construct
                    if (token.is(closer)) advance();
                    return;
                }
                depth--;
            }
            advance();
        }
    }

    protected static boolean isOpener(Token token) {
        return token.is("(") || token.is("[") || token.is("{");
    }

    protected static boolean isCloser(Token token) {
        return token.is(")") || token.is("]") || token.is("}");
    }

    protected static String closerFor(String opener) {
        switch (opener) {
            case "(": return ")";
            case "[": return "]";
            default: return "}";
        }
    }

    /** Checks the statement nesting limit; reports and returns false when it is exceeded. */
    protected boolean enterNested(Token at) {
        if (nesting >= MAX_NESTING) {
            error(at, ErrorKind.UNEXPECTED_TOKEN, "Code is nested too deeply to analyze",
                    "Split the code into smaller functions");
            return false;
        }
        nesting++;
        return true;
    }

    protected void exitNested() {
        nesting--;
    }

    // ---- node factories ----

    protected int errorNode(Token start, final String reason) {
        final Span span = spanFrom(start);
        return tree.add(id -> new ErrorNode(id, span, reason)).getId();
    }

    protected int unsupported(Token start, final String construct) {
        final Span span = spanFrom(start);
        return tree.add(id -> new UnsupportedNode(id, span, construct)).getId();
    }

    protected int identifier(final Token name) {
        final Span span = spanFrom(name);
        return tree.add(id -> new IdentifierNode(id, span, name.getText())).getId();
    }

    protected int integerLiteral(Token at, final long value) {
        final Span span = spanFrom(at);
        return tree.add(id -> LiteralNode.ofInteger(id, span, value)).getId();
    }

    protected int binary(Token start, final BinaryOperator operator, final int left, final int right) {
        final Span span = spanFrom(start);
        return tree.add(id -> new BinaryOpNode(id, span, operator, left, right)).getId();
    }

    protected int expressionStatement(Token start, final int expression) {
        final Span span = spanFrom(start);
        return tree.add(id -> new ExpressionStatementNode(id, span, expression)).getId();
    }

    protected int assignment(Token start, final int target, final BinaryOperator compound, final int value) {
        final Span span = spanFrom(start);
        return tree.add(id -> new AssignmentNode(id, span, target, compound, value)).getId();
    }

    /**
     * Wraps parsed statements into a block. The block starts at its header line and its column
     * is that of the first statement.
     */
    protected int block(final Token header, final List<Integer> statements, final boolean delimited) {
        int column = statements.isEmpty() ? header.getColumn() : tree.get(statements.get(0)).getColumn();
        final Span span = new Span(header.getLine(), endLineFrom(header.getLine()), column);
        return tree.add(id -> new BlockNode(id, span, statements, delimited, header.getLine(), header.getColumn())).getId();
    }

    protected boolean isErrorNode(int id) {
        return id != Node.NONE && tree.get(id).kind() == NodeKind.ERROR;
    }

    protected boolean isAssignable(int id) {
        NodeKind kind = tree.get(id).kind();
        return kind == NodeKind.IDENTIFIER || kind == NodeKind.INDEX_ACCESS || kind == NodeKind.MEMBER_ACCESS;
    }

    // ---- statements shared by every language ----

    /**
     * An expression, optionally followed by an assignment or an increment. Leaves the statement
     * terminator to the caller. Returns {@link Node#NONE} when nothing usable was parsed.
     */
    protected int parseSimpleStatement(Token start) {
        if (check("++") || check("--")) {
            Token op = advance();
            int target = parseExpression();
            return increment(start, op, target);
        }
        int target = parseExpression();
        Token op = peek();
        BinaryOperator compound = op.is(TokenType.OPERATOR) ? BinaryOperator.forCompoundAssignment(op.getText()) : null;
        if (op.is("=") || compound != null) {
            advance();
            if (!isErrorNode(target) && !isAssignable(target)) {
                error(op, ErrorKind.UNEXPECTED_TOKEN, "Cannot assign to this expression",
                        "Put a variable name on the left of " + op.describe());
            }
            int value = parseExpression();
            return assignment(start, target, compound, value);
        }
        if (!language.usesIndentation() && (op.is("++") || op.is("--"))) {
            advance();
            return increment(start, op, target);
        }
        if (isErrorNode(target)) {
            return Node.NONE;
        }
        return expressionStatement(start, target);
    }

    private int increment(Token start, Token op, int target) {
        if (!isErrorNode(target) && !isAssignable(target)) {
            error(op, ErrorKind.UNEXPECTED_TOKEN, "Cannot apply " + op.describe() + " to this expression",
                    "Use " + op.describe() + " on a variable");
        }
        int one = integerLiteral(op, 1);
        return assignment(start, target, op.is("++") ? BinaryOperator.ADD : BinaryOperator.SUBTRACT, one);
    }

    /**
     * A loop or branch condition. A lone {@code =} is reported and read as a comparison so the
     * rest of the statement still parses.
     */
    protected int parseCondition() {
        Token start = peek();
        int condition = parseExpression();
        if (check("=")) {
            Token op = advance();
            error(op, ErrorKind.ASSIGNMENT_IN_CONDITION, "'=' assigns a value; a condition needs '==' to compare",
                    "Replace '=' with '=='");
            int right = parseExpression();
            return binary(start, BinaryOperator.EQUAL, condition, right);
        }
        return condition;
    }

    // ---- expressions ----

    protected int parseExpression() {
        Token start = peek();
        if (nesting >= MAX_NESTING) {
            error(start, ErrorKind.UNEXPECTED_TOKEN, "Expression is nested too deeply to analyze",
                    "Break the expression into smaller steps");
            if (!start.is(TokenType.EOF) && !start.isLayout()) advance();
            return errorNode(start, "nesting limit");
        }
        nesting++;
        try {
            int expression = parseOr();
            if (!language.usesIndentation() && check("?")) {
                advance();
                parseExpression();
                if (match(":")) parseExpression();
                return unsupported(start, "conditional expression (?:)");
            }
            if (language.usesIndentation() && check("if") && peek().getLine() == previous().getLine()) {
                advance();
                parseOr();
                if (match("else")) parseExpression();
                return unsupported(start, "conditional expression (x if c else y)");
            }
            return expression;
        } finally {
            nesting--;
        }
    }

    private int parseOr() {
        Token start = peek();
        int left = parseAnd();
        while (check("||") || (language.usesIndentation() && check("or"))) {
            advance();
            int right = parseAnd();
            left = binary(start, BinaryOperator.OR, left, right);
        }
        return left;
    }

    private int parseAnd() {
        Token start = peek();
        int left = parseNot();
        while (check("&&") || (language.usesIndentation() && check("and"))) {
            advance();
            int right = parseNot();
            left = binary(start, BinaryOperator.AND, left, right);
        }
        return left;
    }

    private int parseNot() {
        if (language.usesIndentation() && check("not")) {
            final Token start = advance();
            final int operand = parseNot();
            final Span span = spanFrom(start);
            return tree.add(id -> new UnaryOpNode(id, span, UnaryOperator.NOT, operand)).getId();
        }
        return parseComparison();
    }

    private int parseComparison() {
        Token start = peek();
        int left = parseAdditive();
        while (true) {
            BinaryOperator operator = comparisonOperator();
            if (operator == null) {
                return left;
            }
            int right = parseAdditive();
            left = binary(start, operator, left, right);
        }
    }

    /** Consumes a comparison operator when one is next. */
    private BinaryOperator comparisonOperator() {
        Token token = peek();
        if (token.is(TokenType.OPERATOR)) {
            BinaryOperator operator;
            switch (token.getText()) {
                case "==": operator = BinaryOperator.EQUAL; break;
                case "!=": operator = BinaryOperator.NOT_EQUAL; break;
                case "===": operator = BinaryOperator.STRICT_EQUAL; break;
                case "!==": operator = BinaryOperator.STRICT_NOT_EQUAL; break;
                case "<": operator = BinaryOperator.LESS; break;
                case "<=": operator = BinaryOperator.LESS_EQUAL; break;
                case ">": operator = BinaryOperator.GREATER; break;
                case ">=": operator = BinaryOperator.GREATER_EQUAL; break;
                default: return null;
            }
            advance();
            return operator;
        }
        if (!language.usesIndentation()) {
            return null;
        }
        if (token.is("in")) {
            advance();
            return BinaryOperator.IN;
        }
        if (token.is("not") && peek(1).is("in")) {
            advance();
            advance();
            return BinaryOperator.NOT_IN;
        }
        if (token.is("is")) {
            advance();
            return match("not") ? BinaryOperator.NOT_EQUAL : BinaryOperator.EQUAL;
        }
        return null;
    }

    private int parseAdditive() {
        Token start = peek();
        int left = parseMultiplicative();
        while (check("+") || check("-")) {
            BinaryOperator operator = advance().is("+") ? BinaryOperator.ADD : BinaryOperator.SUBTRACT;
            int right = parseMultiplicative();
            left = binary(start, operator, left, right);
        }
        return left;
    }

    private int parseMultiplicative() {
        Token start = peek();
        int left = parseUnary();
        while (true) {
            BinaryOperator operator;
            if (check("*")) {
                operator = BinaryOperator.MULTIPLY;
            } else if (check("/")) {
                operator = BinaryOperator.DIVIDE;
            } else if (check("//")) {
                operator = BinaryOperator.FLOOR_DIVIDE;
            } else if (check("%")) {
                operator = BinaryOperator.MODULO;
            } else {
                return left;
            }
            advance();
            int right = parseUnary();
            left = binary(start, operator, left, right);
        }
    }

    protected int parseUnary() {
        final UnaryOperator operator;
        if (check("-")) {
            operator = UnaryOperator.NEGATE;
        } else if (check("+")) {
            operator = UnaryOperator.PLUS;
        } else if (check("!") && !language.usesIndentation()) {
            operator = UnaryOperator.NOT;
        } else {
            return parsePower();
        }
        final Token start = advance();
        if (nesting >= MAX_NESTING) {
            return parseExpression();
        }
        nesting++;
        try {
            final int operand = parseUnary();
            final Span span = spanFrom(start);
            return tree.add(id -> new UnaryOpNode(id, span, operator, operand)).getId();
        } finally {
            nesting--;
        }
    }

    private int parsePower() {
        Token start = peek();
        int base = parsePostfix();
        if (check("**")) {
            advance();
            int exponent = parseUnary();
            return binary(start, BinaryOperator.POWER, base, exponent);
        }
        return base;
    }

    protected int parsePostfix() {
        final Token start = peek();
        int expression = parsePrimary();
        while (true) {
            if (check("(")) {
                advance();
                final int callee = expression;
                final List<Integer> arguments = parseArguments();
                final Span span = spanFrom(start);
                expression = tree.add(id -> new CallNode(id, span, callee, arguments)).getId();
            } else if (check("[")) {
                advance();
                final int target = expression;
                final int index = parseExpression();
                if (!match("]")) {
                    unexpected(peek());
                    skipPast("]");
                }
                final Span span = spanFrom(start);
                expression = tree.add(id -> new IndexAccessNode(id, span, target, index)).getId();
            } else if (check(".") && peek(1).is(TokenType.NAME)) {
                advance();
                final String member = advance().getText();
                final int target = expression;
                final Span span = spanFrom(start);
                expression = tree.add(id -> new MemberAccessNode(id, span, target, member)).getId();
            } else if (check("=>") || check("->")) {
                advance();
                if (check("{")) {
                    advance();
                    skipPast("}");
                } else {
                    parseExpression();
                }
                return unsupported(start, language.usesIndentation() ? "lambda" : "arrow function");
            } else {
                return expression;
            }
        }
    }

    /** Arguments after an already consumed '(' up to and including the matching ')'. */
    protected List<Integer> parseArguments() {
        List<Integer> arguments = new ArrayList<>();
        if (match(")")) {
            return arguments;
        }
        while (true) {
            arguments.add(parseExpression());
            if (match(")")) {
                return arguments;
            }
            if (!match(",")) {
                Token at = peek();
                error(at, ErrorKind.UNEXPECTED_TOKEN, "Expected ',' or ')' but found " + at.describe(),
                        "Separate arguments with commas");
                skipPast(")");
                return arguments;
            }
            if (match(")")) {
                return arguments;
            }
        }
    }

    protected int parsePrimary() {
        final Token token = peek();
        int hooked = primaryHook(token);
        if (hooked != Node.NONE) {
            return hooked;
        }
        switch (token.getType()) {
            case NUMBER:
                advance();
                return numberLiteral(token);
            case STRING: {
                advance();
                final Span span = spanFrom(token);
                return tree.add(id -> LiteralNode.ofString(id, span, token.getText())).getId();
            }
            case NAME:
                return parseName(token);
            case OPERATOR:
                if (token.is("(")) {
                    return parseParenthesized();
                }
                if (token.is("[")) {
                    return parseListLiteral();
                }
                if (token.is("{")) {
                    advance();
                    skipPast("}");
                    return unsupported(token, language.usesIndentation() ? "dictionary or set" : "object literal");
                }
                error(token, ErrorKind.UNEXPECTED_TOKEN, "Expected a value but found " + token.describe(),
                        "Add a value or remove " + token.describe());
                if (!isCloser(token) && !token.is(";") && !token.is(",")) {
                    advance();
                }
                return errorNode(token, "expected a value");
            default:
                errorAfterPrevious(ErrorKind.UNEXPECTED_TOKEN, "Expected a value before the " + token.describe(),
                        "Finish the expression");
                return errorNode(previous(), "expected a value");
        }
    }

    private int parseName(final Token token) {
        LiteralKeyword keyword = literalKeyword(token.getText());
        if (keyword != null) {
            advance();
            final Span span = spanFrom(token);
            switch (keyword) {
                case TRUE: return tree.add(id -> LiteralNode.ofBoolean(id, span, true)).getId();
                case FALSE: return tree.add(id -> LiteralNode.ofBoolean(id, span, false)).getId();
                default: return tree.add(id -> LiteralNode.ofNone(id, span)).getId();
            }
        }
        if (isReserved(token.getText())) {
            error(token, ErrorKind.UNEXPECTED_TOKEN, "'" + token.getText() + "' cannot be used here",
                    "Start '" + token.getText() + "' on a line of its own");
            return errorNode(token, "keyword in expression");
        }
        advance();
        return identifier(token);
    }

    private int numberLiteral(final Token token) {
        String text = token.getText();
        final Span span = spanFrom(token);
        char suffix = text.charAt(text.length() - 1);
        boolean floatSuffix = suffix == 'f' || suffix == 'F' || suffix == 'd' || suffix == 'D';
        if (floatSuffix || suffix == 'l' || suffix == 'L') {
            text = text.substring(0, text.length() - 1);
        }
        boolean floating = floatSuffix || text.indexOf('.') >= 0 || text.indexOf('e') >= 0 || text.indexOf('E') >= 0;
        if (!floating) {
            try {
                final long value = Long.parseLong(text);
                return tree.add(id -> LiteralNode.ofInteger(id, span, value)).getId();
            } catch (NumberFormatException e) {
                // too large for a long, keep it as a float
            }
        }
        final double value = Double.parseDouble(text);
        return tree.add(id -> LiteralNode.ofFloat(id, span, value)).getId();
    }

    protected int parseParenthesized() {
        Token open = advance();
        if (match(")")) {
            return unsupported(open, "empty tuple");
        }
        int inner = parseExpression();
        if (match(")")) {
            return inner;
        }
        if (check(",")) {
            skipPast(")");
            return unsupported(open, "tuple");
        }
        unexpected(peek());
        skipPast(")");
        return inner;
    }

    private int parseListLiteral() {
        final Token open = advance();
        final List<Integer> elements = new ArrayList<>();
        while (!check("]") && !atEnd() && !checkType(TokenType.NEWLINE)) {
            elements.add(parseExpression());
            if (check("for")) {
                skipPast("]");
                return unsupported(open, "list comprehension");
            }
            if (!match(",")) {
                break;
            }
        }
        if (!match("]")) {
            unexpected(peek());
            skipPast("]");
        }
        final Span span = spanFrom(open);
        return tree.add(id -> new ListLiteralNode(id, span, elements)).getId();
    }
}
