package com.frosted.tracer;

import com.frosted.tracer.model.AnalysisReport;
import com.frosted.tracer.model.CapturedText;
import com.frosted.tracer.model.ErrorKind;
import com.frosted.tracer.model.Language;
import com.frosted.tracer.model.Severity;
import com.frosted.tracer.model.SourceText;
import com.frosted.tracer.model.StaticError;
import com.frosted.tracer.syntax.ParseResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CodeTracerTest {

    private static final double MIN_CONFIDENCE = 0.6;

    private final CodeTracer tracer = new CodeTracer();

    @Test
    @DisplayName("An unclosed call is reported on its line and nothing is simulated")
    void unclosedBracket() {
        AnalysisReport report = tracer.analyze(CapturedText.typed("x = 1\nprint(x\n"), MIN_CONFIDENCE, null);

        assertThat(report.getLanguage()).isEqualTo(Language.PYTHON_LIKE);
        assertThat(report.getErrors()).isNotEmpty();
        StaticError first = report.getErrors().get(0);
        assertThat(first.getKind()).isEqualTo(ErrorKind.UNMATCHED_BRACKET);
        assertThat(first.getLine()).isEqualTo(2);
        assertThat(report.isSimulated()).isFalse();
        assertThat(report.getTrace()).isNull();
    }

    @Test
    void lowConfidenceCaptureIsNotParsed() {
        AnalysisReport report = tracer.analyze(new CapturedText("x = 1\n", 0.3), MIN_CONFIDENCE, null);

        assertThat(report.getErrors()).hasSize(1);
        StaticError advisory = report.getErrors().get(0);
        assertThat(advisory.getKind()).isEqualTo(ErrorKind.LOW_CONFIDENCE);
        assertThat(advisory.getLine()).isEqualTo(1);
        assertThat(advisory.getMessage()).isEqualTo("The scan is hard to read (confidence 0.30)");
        assertThat(report.isSimulated()).isFalse();
    }

    @Test
    void cleanProgramIsTraced() {
        String code = "total = 0\nfor n in range(1, 4):\n    total += n\nprint(total)\n";

        AnalysisReport report = tracer.analyze(CapturedText.typed(code), MIN_CONFIDENCE, null);

        assertThat(report.getErrors()).isEmpty();
        assertThat(report.isCompletedSuccessfully()).isTrue();
        assertThat(report.getTrace().getOutput()).isEqualTo("6\n");
        assertThat(report.getLineCount()).isEqualTo(4);
        assertThat(report.getSourceHash()).isEqualTo(SourceText.of(code).contentHash());
    }

    @Test
    @DisplayName("Warnings alone do not stop the simulation")
    void warningsStillSimulate() {
        String code = "def sign(n):\n    if n > 0:\n        return 1\n\nprint(sign(5))\n";

        AnalysisReport report = tracer.analyze(CapturedText.typed(code), MIN_CONFIDENCE, null);

        assertThat(report.getErrors()).extracting(StaticError::getSeverity).containsOnly(Severity.WARNING);
        assertThat(report.hasErrors()).isFalse();
        assertThat(report.isSimulated()).isTrue();
        assertThat(report.getTrace().getOutput()).isEqualTo("1\n");
    }

    @Test
    @DisplayName("Parser and checker findings for the same line and kind are merged")
    void duplicateFindingsAreMerged() {
        AnalysisReport report = tracer.analyze(CapturedText.typed("x = 2\nif x > 1\n    print(x)\n"),
                MIN_CONFIDENCE, null);

        assertThat(report.getErrors()).filteredOn(error -> error.getKind() == ErrorKind.MISSING_DELIMITER).hasSize(1);
        assertThat(report.getErrors()).isSortedAccordingTo(StaticError.ORDER);
        assertThat(report.isSimulated()).isFalse();
    }

    @Test
    void languageHint() {
        CapturedText ambiguous = CapturedText.typed("x = 1\n");
        CapturedText python = CapturedText.typed("def f():\n    return 1\n");

        assertThat(tracer.analyze(ambiguous, MIN_CONFIDENCE, Language.JAVA_LIKE).getLanguage())
                .isEqualTo(Language.JAVA_LIKE);
        assertThat(tracer.analyze(ambiguous, MIN_CONFIDENCE, Language.JAVASCRIPT_LIKE, true).getLanguage())
                .isEqualTo(Language.JAVASCRIPT_LIKE);
        assertThat(tracer.analyze(python, MIN_CONFIDENCE, Language.JAVA_LIKE, true).getLanguage())
                .isEqualTo(Language.PYTHON_LIKE);
    }

    @Test
    void stagesCanRunOnTheirOwn() {
        Language language = tracer.detectLanguage("let a = 1;\nconsole.log(a);\n");

        assertThat(language).isEqualTo(Language.JAVASCRIPT_LIKE);
        ParseResult parsed = tracer.parse("let a = 1;\nconsole.log(a);\n", language);
        assertThat(parsed.hasErrors()).isFalse();
        assertThat(tracer.checkStatic(parsed.getTree())).isEmpty();
        assertThat(tracer.simulate(parsed.getTree()).getTrace().getOutput()).isEqualTo("1\n");
    }
}
