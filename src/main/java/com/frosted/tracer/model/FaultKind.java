package com.frosted.tracer.model;

public enum FaultKind {
    DIVISION_BY_ZERO,
    INDEX_OUT_OF_RANGE,
    UNBOUND_RECURSION,
    STEP_BUDGET_EXCEEDED,
    UNSUPPORTED_CONSTRUCT,
    TYPE_MISMATCH,
    UNDEFINED_NAME
}
