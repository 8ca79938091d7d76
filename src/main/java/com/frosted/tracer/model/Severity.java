package com.frosted.tracer.model;

public enum Severity {
    ERROR,
    WARNING
}
