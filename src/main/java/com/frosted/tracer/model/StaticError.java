package com.frosted.tracer.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Comparator;
import java.util.Objects;

/**
 * A defect detected without executing the code, either while parsing or by the rule checker.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class StaticError {

    /** Line ascending, errors before warnings, then column and kind. Highlighting relies on it. */
    public static final Comparator<StaticError> ORDER = Comparator
            .comparingInt(StaticError::getLine)
            .thenComparing(StaticError::getSeverity)
            .thenComparingInt(StaticError::getColumn)
            .thenComparing(StaticError::getKind);

    private final int line;
    private final int column;
    private final ErrorKind kind;
    private final Severity severity;
    private final String message;
    private final String suggestedFix;

    public StaticError(int line, int column, ErrorKind kind, Severity severity, String message, String suggestedFix) {
        this.line = line;
        this.column = column;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.severity = Objects.requireNonNull(severity, "severity");
        this.message = message != null ? message : "";
        this.suggestedFix = suggestedFix;
    }

    public static StaticError error(int line, int column, ErrorKind kind, String message, String suggestedFix) {
        return new StaticError(line, column, kind, Severity.ERROR, message, suggestedFix);
    }

    public static StaticError warning(int line, int column, ErrorKind kind, String message, String suggestedFix) {
        return new StaticError(line, column, kind, Severity.WARNING, message, suggestedFix);
    }

    public int getLine() { return line; }

    public int getColumn() { return column; }

    public ErrorKind getKind() { return kind; }

    public Severity getSeverity() { return severity; }

    public String getMessage() { return message; }

    public String getSuggestedFix() { return suggestedFix; }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StaticError)) return false;
        StaticError that = (StaticError) o;
        return line == that.line && column == that.column && kind == that.kind
                && severity == that.severity && message.equals(that.message)
                && Objects.equals(suggestedFix, that.suggestedFix);
    }

    @Override
    public int hashCode() {
        return Objects.hash(line, column, kind, severity, message, suggestedFix);
    }

    @Override
    public String toString() {
        return severity + " " + kind + " at " + line + ":" + column + " - " + message;
    }
}
