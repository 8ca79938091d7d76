package com.frosted.tracer.model;

/**
 * Kinds of defects found without running the code.
 */
public enum ErrorKind {
    MISSING_DELIMITER,
    BAD_INDENTATION,
    UNDEFINED_VARIABLE,
    UNMATCHED_BRACKET,
    MISSING_RETURN,
    UNEXPECTED_TOKEN,
    ASSIGNMENT_IN_CONDITION,
    UNREACHABLE_CODE,
    RETURN_OUTSIDE_FUNCTION,
    CONST_REASSIGNMENT,
    // advisory produced when recognized text is too unreliable to parse
    LOW_CONFIDENCE
}
