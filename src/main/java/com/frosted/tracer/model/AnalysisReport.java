package com.frosted.tracer.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Combined result of one scan: detected language, ordered errors and, when the snippet
 * parsed cleanly, its execution trace.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AnalysisReport {
    private final Language language;
    private final String sourceHash;
    private final int lineCount;
    private final List<StaticError> errors;
    private final ExecutionTrace trace;
    private final RuntimeFault fault;
    private final boolean simulated;

    public AnalysisReport(Language language, String sourceHash, int lineCount, List<StaticError> errors,
                          SimulationResult simulation) {
        this.language = language;
        this.sourceHash = sourceHash;
        this.lineCount = lineCount;
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
        this.simulated = simulation != null;
        this.trace = simulation != null ? simulation.getTrace() : null;
        this.fault = simulation != null ? simulation.getFault() : null;
    }

    public Language getLanguage() { return language; }

    public String getSourceHash() { return sourceHash; }

    public int getLineCount() { return lineCount; }

    public List<StaticError> getErrors() { return errors; }

    public ExecutionTrace getTrace() { return trace; }

    public RuntimeFault getFault() { return fault; }

    public boolean isSimulated() { return simulated; }

    public boolean isCompletedSuccessfully() {
        return simulated && fault == null;
    }

    public boolean hasErrors() {
        return errors.stream().anyMatch(StaticError::isError);
    }
}
