package com.frosted.tracer.syntax;

import com.frosted.tracer.model.ErrorKind;
import com.frosted.tracer.model.Language;
import com.frosted.tracer.model.SourceText;
import com.frosted.tracer.model.StaticError;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns source text into tokens for one language.
 *
 * <p>Indentation-significant languages get NEWLINE, INDENT and DEDENT tokens. Brackets are
 * repaired on the way: an opener that is never closed is reported and closed with a synthetic
 * token, a closer without an opener is reported and dropped. The parser therefore always sees
 * balanced brackets. An unclosed parenthesis or square bracket is closed where its statement
 * ends: at the end of the logical line in indentation languages, and in brace languages at a
 * {@code ;} or before a line that starts a new statement.
 */
public final class Lexer {
    private static final String[] OPERATORS = {
            "**=", "//=", "===", "!==", "...",
            "**", "//", "==", "!=", "<=", ">=", "&&", "||", "++", "--",
            "+=", "-=", "*=", "/=", "%=", "=>", "->", "::"
    };
    private static final String SINGLE_CHAR_OPERATORS = "+-*/%=<>!()[]{},.:;?&|^~@";
    private static final String OPENERS = "([{";
    private static final String CLOSERS = ")]}";
    private static final int TAB_SIZE = 8;
    private static final Set<String> STATEMENT_WORDS = new HashSet<>(Arrays.asList(
            "let", "const", "var", "if", "while", "for", "do", "return", "break", "continue",
            "function", "class", "public", "private", "protected", "static",
            "int", "long", "double", "float", "boolean", "char", "void", "console", "System"));

    private final String text;
    private final int sourceLines;
    private final Language language;
    private final ErrorSink errors;

    private final List<Token> tokens = new ArrayList<>();
    private final Deque<OpenBracket> brackets = new ArrayDeque<>();
    private final Deque<IndentLevel> indents = new ArrayDeque<>();

    private int pos;
    private int line = 1;
    private int lineStart;
    private int lineIndent;
    private boolean atLineStart = true;

    public Lexer(SourceText source, Language language, ErrorSink errors) {
        this.text = source.getText();
        this.sourceLines = source.lineCount();
        this.language = language;
        this.errors = errors;
    }

    public List<Token> tokenize() {
        indents.push(new IndentLevel(0, false));
        while (pos < text.length()) {
            if (atLineStart) {
                atLineStart = false;
                if (language.usesIndentation() && brackets.isEmpty()) {
                    handleIndentation();
                    continue;
                }
            }
            char c = text.charAt(pos);
            if (c == '\n') {
                newline();
            } else if (c == ' ' || c == '\t' || c == '\f') {
                pos++;
            } else if (language.usesIndentation() && c == '#') {
                skipToLineEnd();
            } else if (language.usesIndentation() && c == '\\' && peekChar(1) == '\n') {
                pos++;
                nextPhysicalLine();
                atLineStart = false;
            } else if (!language.usesIndentation() && c == '/' && peekChar(1) == '/') {
                skipToLineEnd();
            } else if (!language.usesIndentation() && c == '/' && peekChar(1) == '*') {
                skipBlockComment();
            } else if (c == '"' || c == '\'' || (c == '`' && !language.usesIndentation())) {
                readString(c);
            } else if (Character.isDigit(c) || (c == '.' && Character.isDigit(peekChar(1)))) {
                readNumber();
            } else if (isNameStart(c)) {
                readName();
            } else {
                readOperator();
            }
        }
        finish();
        return tokens;
    }

    private void handleIndentation() {
        int width = 0;
        int i = pos;
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            width = text.charAt(i) == '\t' ? width + TAB_SIZE - width % TAB_SIZE : width + 1;
            i++;
        }
        pos = i;
        if (i >= text.length() || text.charAt(i) == '\n' || text.charAt(i) == '#') {
            // blank or comment-only line, indentation is meaningless
            return;
        }
        lineIndent = width;
        IndentLevel top = indents.peek();
        if (width > top.width) {
            indents.push(new IndentLevel(width, false));
            emit(TokenType.INDENT, "", column());
        } else if (width < top.width) {
            while (indents.peek().width > width) {
                IndentLevel level = indents.pop();
                if (!level.phantom) emit(TokenType.DEDENT, "", column());
            }
            if (indents.peek().width != width) {
                errors.report(StaticError.error(line, column(), ErrorKind.BAD_INDENTATION,
                        "This line's indentation does not match any enclosing block",
                        "Line this statement up with the block it belongs to"));
                // track the odd level without opening a block so later lines at it stay quiet
                indents.push(new IndentLevel(width, true));
            }
        }
    }

    private void newline() {
        if (language.usesIndentation()) {
            if (!brackets.isEmpty()) {
                if (continuesOnNextLine()) {
                    nextPhysicalLine();
                    atLineStart = false;
                    return;
                }
                closeAllBrackets();
            }
            if (lastIsSignificant()) {
                emit(TokenType.NEWLINE, "", column());
            }
        } else if (hasOpenExpressionBracket() && endsOperand() && nextLineStartsStatement()) {
            closeExpressionBrackets();
        }
        nextPhysicalLine();
    }

    /**
     * Inside open brackets a physical line continues the logical one when it ends with an opener
     * or a comma, or when the next code line closes a bracket or is indented past the line that
     * opened the outermost bracket.
     */
    private boolean continuesOnNextLine() {
        Token last = tokens.get(tokens.size() - 1);
        if (last.is(TokenType.OPERATOR) && (OPENERS.contains(last.getText()) || last.is(","))) {
            return true;
        }
        int i = pos + 1;
        while (i < text.length()) {
            int width = 0;
            int j = i;
            while (j < text.length() && (text.charAt(j) == ' ' || text.charAt(j) == '\t')) {
                width = text.charAt(j) == '\t' ? width + TAB_SIZE - width % TAB_SIZE : width + 1;
                j++;
            }
            if (j >= text.length()) return false;
            char first = text.charAt(j);
            if (first == '\n' || first == '#') {
                int end = text.indexOf('\n', j);
                if (end < 0) return false;
                i = end + 1;
                continue;
            }
            return CLOSERS.indexOf(first) >= 0 || width > brackets.peekLast().lineIndent;
        }
        return false;
    }

    private boolean hasOpenExpressionBracket() {
        return !brackets.isEmpty() && !brackets.peek().token.is("{") && !brackets.peek().loopHeader;
    }

    /** Whether the last token can end an expression, so a line break after it may end the statement. */
    private boolean endsOperand() {
        Token last = tokens.get(tokens.size() - 1);
        return !last.is(TokenType.OPERATOR) || last.is(")") || last.is("]");
    }

    private boolean nextLineStartsStatement() {
        int i = pos + 1;
        while (i < text.length()) {
            while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) i++;
            if (i >= text.length()) return false;
            if (text.charAt(i) == '\n' || text.startsWith("//", i)) {
                int end = text.indexOf('\n', i);
                if (end < 0) return false;
                i = end + 1;
                continue;
            }
            int end = i;
            while (end < text.length() && isNamePart(text.charAt(end))) end++;
            return end > i && STATEMENT_WORDS.contains(text.substring(i, end));
        }
        return false;
    }

    /** Closes the parentheses and square brackets left open by the statement that just ended. */
    private void closeExpressionBrackets() {
        while (hasOpenExpressionBracket()) {
            closeSynthetically(brackets.pop());
        }
    }

    private void nextPhysicalLine() {
        pos++;
        line++;
        lineStart = pos;
        atLineStart = true;
    }

    private void skipToLineEnd() {
        while (pos < text.length() && text.charAt(pos) != '\n') {
            pos++;
        }
    }

    private void skipBlockComment() {
        int startLine = line;
        int startColumn = column();
        pos += 2;
        while (pos < text.length()) {
            if (text.charAt(pos) == '*' && peekChar(1) == '/') {
                pos += 2;
                return;
            }
            if (text.charAt(pos) == '\n') {
                nextPhysicalLine();
                atLineStart = false;
            } else {
                pos++;
            }
        }
        errors.report(StaticError.error(startLine, startColumn, ErrorKind.MISSING_DELIMITER,
                "Comment is never closed", "Add */ at the end of the comment"));
    }

    private void readString(char quote) {
        int startLine = line;
        int startColumn = column();
        boolean triple = language.usesIndentation() && peekChar(1) == quote && peekChar(2) == quote;
        boolean multiLine = triple || quote == '`';
        pos += triple ? 3 : 1;
        StringBuilder sb = new StringBuilder();
        boolean closed = false;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (triple && c == quote && peekChar(1) == quote && peekChar(2) == quote) {
                pos += 3;
                closed = true;
                break;
            }
            if (!triple && c == quote) {
                pos++;
                closed = true;
                break;
            }
            if (c == '\n') {
                if (!multiLine) break;
                sb.append('\n');
                nextPhysicalLine();
                atLineStart = false;
                continue;
            }
            if (c == '\\' && pos + 1 < text.length()) {
                char escaped = text.charAt(pos + 1);
                pos++;
                if (escaped == '\n') {
                    nextPhysicalLine();
                    atLineStart = false;
                    continue;
                }
                sb.append(unescape(escaped));
                pos++;
                continue;
            }
            sb.append(c);
            pos++;
        }
        if (!closed) {
            errors.report(StaticError.error(startLine, startColumn, ErrorKind.MISSING_DELIMITER,
                    "String is missing its closing " + quote,
                    "Add " + quote + " at the end of the string"));
        }
        tokens.add(new Token(TokenType.STRING, sb.toString(), startLine, startColumn));
    }

    private static char unescape(char c) {
        switch (c) {
            case 'n': return '\n';
            case 't': return '\t';
            case 'r': return '\r';
            case '0': return '\0';
            default: return c;
        }
    }

    private void readNumber() {
        int start = pos;
        int startColumn = column();
        while (pos < text.length() && (Character.isDigit(text.charAt(pos)) || text.charAt(pos) == '_')) pos++;
        if (pos < text.length() && text.charAt(pos) == '.' && Character.isDigit(peekChar(1))) {
            pos++;
            while (pos < text.length() && (Character.isDigit(text.charAt(pos)) || text.charAt(pos) == '_')) pos++;
        }
        if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
            char next = peekChar(1);
            if (Character.isDigit(next) || ((next == '+' || next == '-') && Character.isDigit(peekChar(2)))) {
                pos += 2;
                while (pos < text.length() && Character.isDigit(text.charAt(pos))) pos++;
            }
        }
        if (!language.usesIndentation() && pos < text.length() && "lLfFdD".indexOf(text.charAt(pos)) >= 0
                && !isNamePart(peekChar(1))) {
            pos++;
        }
        String number = text.substring(start, pos).replace("_", "");
        tokens.add(new Token(TokenType.NUMBER, number, line, startColumn));
    }

    private void readName() {
        int start = pos;
        int startColumn = column();
        while (pos < text.length() && isNamePart(text.charAt(pos))) pos++;
        tokens.add(new Token(TokenType.NAME, text.substring(start, pos), line, startColumn));
    }

    private void readOperator() {
        for (String op : OPERATORS) {
            if (text.startsWith(op, pos)) {
                if (op.startsWith("//") && !language.usesIndentation()) continue;
                emit(TokenType.OPERATOR, op, column());
                pos += op.length();
                return;
            }
        }
        char c = text.charAt(pos);
        if (SINGLE_CHAR_OPERATORS.indexOf(c) < 0) {
            errors.report(StaticError.error(line, column(), ErrorKind.UNEXPECTED_TOKEN,
                    "Unexpected character '" + c + "'", "Remove '" + c + "'"));
            pos++;
            return;
        }
        if (OPENERS.indexOf(c) >= 0) {
            Token opener = new Token(TokenType.OPERATOR, String.valueOf(c), line, column());
            boolean loopHeader = c == '(' && !language.usesIndentation() && !tokens.isEmpty()
                    && tokens.get(tokens.size() - 1).is("for");
            brackets.push(new OpenBracket(opener, lineIndent, loopHeader));
            tokens.add(opener);
        } else if (CLOSERS.indexOf(c) >= 0) {
            closeBracket(c);
        } else {
            if (c == ';' && !language.usesIndentation()) {
                closeExpressionBrackets();
            }
            emit(TokenType.OPERATOR, String.valueOf(c), column());
        }
        pos++;
    }

    private void closeBracket(char closer) {
        String opener = String.valueOf(OPENERS.charAt(CLOSERS.indexOf(closer)));
        boolean matched = false;
        for (OpenBracket open : brackets) {
            if (open.token.getText().equals(opener)) {
                matched = true;
                break;
            }
        }
        if (!matched) {
            errors.report(StaticError.error(line, column(), ErrorKind.UNMATCHED_BRACKET,
                    "'" + closer + "' has no matching '" + opener + "'",
                    "Remove this '" + closer + "' or add the missing '" + opener + "'"));
            return;
        }
        while (!brackets.peek().token.getText().equals(opener)) {
            closeSynthetically(brackets.pop());
        }
        brackets.pop();
        emit(TokenType.OPERATOR, String.valueOf(closer), column());
    }

    private void closeAllBrackets() {
        while (!brackets.isEmpty()) {
            closeSynthetically(brackets.pop());
        }
    }

    private void closeSynthetically(OpenBracket open) {
        Token opener = open.token;
        String closer = String.valueOf(CLOSERS.charAt(OPENERS.indexOf(opener.getText())));
        errors.report(StaticError.error(opener.getLine(), opener.getColumn(), ErrorKind.UNMATCHED_BRACKET,
                "'" + opener.getText() + "' on line " + opener.getLine() + " is never closed",
                "Add the missing '" + closer + "'"));
        tokens.add(new Token(TokenType.OPERATOR, closer, lastSignificantLine(), column(), true));
    }

    private void finish() {
        if (language.usesIndentation()) {
            closeAllBrackets();
            if (lastIsSignificant()) {
                emit(TokenType.NEWLINE, "", column());
            }
            while (indents.size() > 1) {
                IndentLevel level = indents.pop();
                if (!level.phantom) emit(TokenType.DEDENT, "", 1);
            }
        } else {
            // report the outermost opener last so its message does not hide the inner ones
            List<OpenBracket> open = new ArrayList<>(brackets);
            brackets.clear();
            for (OpenBracket bracket : open) {
                closeSynthetically(bracket);
            }
        }
        emit(TokenType.EOF, "", column());
    }

    private void emit(TokenType type, String value, int column) {
        tokens.add(new Token(type, value, Math.min(line, sourceLines), column));
    }

    private boolean lastIsSignificant() {
        return !tokens.isEmpty() && !tokens.get(tokens.size() - 1).isLayout();
    }

    private int lastSignificantLine() {
        for (int i = tokens.size() - 1; i >= 0; i--) {
            if (!tokens.get(i).isLayout()) return tokens.get(i).getLine();
        }
        return Math.min(line, sourceLines);
    }

    private int column() {
        return pos - lineStart + 1;
    }

    private char peekChar(int ahead) {
        int i = pos + ahead;
        return i < text.length() ? text.charAt(i) : '\0';
    }

    private boolean isNameStart(char c) {
        return Character.isLetter(c) || c == '_' || (c == '$' && !language.usesIndentation());
    }

    private boolean isNamePart(char c) {
        return isNameStart(c) || Character.isDigit(c);
    }

    private static final class OpenBracket {
        final Token token;
        final int lineIndent;
        // the parenthesis after 'for', where ';' separates the header clauses
        final boolean loopHeader;

        OpenBracket(Token token, int lineIndent, boolean loopHeader) {
            this.token = token;
            this.lineIndent = lineIndent;
            this.loopHeader = loopHeader;
        }
    }

    private static final class IndentLevel {
        final int width;
        final boolean phantom;

        IndentLevel(int width, boolean phantom) {
            this.width = width;
            this.phantom = phantom;
        }
    }
}
