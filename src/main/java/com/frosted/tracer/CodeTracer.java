package com.frosted.tracer;

import com.frosted.tracer.check.StaticRuleChecker;
import com.frosted.tracer.detect.LanguageDetector;
import com.frosted.tracer.model.AnalysisReport;
import com.frosted.tracer.model.CapturedText;
import com.frosted.tracer.model.ErrorKind;
import com.frosted.tracer.model.Language;
import com.frosted.tracer.model.SimulationResult;
import com.frosted.tracer.model.SourceText;
import com.frosted.tracer.model.StaticError;
import com.frosted.tracer.simulation.ExecutionSimulator;
import com.frosted.tracer.syntax.ParseResult;
import com.frosted.tracer.syntax.SyntaxParser;
import com.frosted.tracer.syntax.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Engine entry point: detect, parse, check and simulate a captured snippet. Holds no state
 * between calls and is safe to share.
 */
public class CodeTracer {
    private static final Logger LOGGER = LoggerFactory.getLogger(CodeTracer.class);

    private final LanguageDetector detector;
    private final SyntaxParser parser;
    private final StaticRuleChecker checker;
    private final ExecutionSimulator simulator;

    public CodeTracer() {
        this(new LanguageDetector(), new SyntaxParser(), new StaticRuleChecker(), new ExecutionSimulator());
    }

    public CodeTracer(LanguageDetector detector, SyntaxParser parser, StaticRuleChecker checker,
                      ExecutionSimulator simulator) {
        this.detector = detector;
        this.parser = parser;
        this.checker = checker;
        this.simulator = simulator;
    }

    public Language detectLanguage(String text) {
        return detector.detect(text);
    }

    public Language detectLanguage(String text, Language previous) {
        return detector.detect(text, previous);
    }

    public ParseResult parse(String text, Language language) {
        return parser.parse(text, language);
    }

    public List<StaticError> checkStatic(SyntaxTree tree) {
        return checker.check(tree);
    }

    public SimulationResult simulate(SyntaxTree tree) {
        return simulator.simulate(tree);
    }

    /**
     * Full pipeline for one capture.
     *
     * @param minConfidence captures below this recognition confidence are not parsed
     * @param languageHint  language to use instead of detection, or the session's previous
     *                      language when {@code detect} is set; may be {@code null}
     */
    public AnalysisReport analyze(CapturedText capture, double minConfidence, Language languageHint) {
        return analyze(capture, minConfidence, languageHint, false);
    }

    /**
     * @param detect when true the hint only breaks ties in detection; otherwise a non-null
     *               hint is used as the language
     */
    public AnalysisReport analyze(CapturedText capture, double minConfidence, Language languageHint, boolean detect) {
        SourceText source = SourceText.of(capture.getText());
        Language language = languageHint != null && !detect
                ? languageHint
                : detector.detect(source.getText(), languageHint);

        if (capture.getConfidence() < minConfidence) {
            LOGGER.info("Capture confidence {} below {}, not parsing", capture.getConfidence(), minConfidence);
            StaticError advisory = StaticError.error(1, 1, ErrorKind.LOW_CONFIDENCE,
                    String.format(Locale.ROOT, "The scan is hard to read (confidence %.2f)", capture.getConfidence()),
                    "Rescan the code in better light or type it in");
            return new AnalysisReport(language, source.contentHash(), source.lineCount(), List.of(advisory), null);
        }

        ParseResult parsed = parser.parse(source, language);
        List<StaticError> errors = merge(parsed.getErrors(), checker.check(parsed.getTree()));
        SimulationResult simulation = parsed.hasErrors() ? null : simulator.simulate(parsed.getTree());

        LOGGER.info("Analyzed {} lines of {}: {} errors, {} steps, fault {}", source.lineCount(), language,
                errors.size(), simulation != null ? simulation.getTrace().size() : 0,
                simulation != null && simulation.getFault() != null ? simulation.getFault().getKind() : "none");
        return new AnalysisReport(language, source.contentHash(), source.lineCount(), errors, simulation);
    }

    /** Parse errors first, then checker findings on lines and kinds not already reported; sorted. */
    static List<StaticError> merge(List<StaticError> syntaxErrors, List<StaticError> ruleErrors) {
        List<StaticError> merged = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (StaticError error : syntaxErrors) {
            if (seen.add(error.getLine() + ":" + error.getKind())) merged.add(error);
        }
        for (StaticError error : ruleErrors) {
            if (seen.add(error.getLine() + ":" + error.getKind())) merged.add(error);
        }
        merged.sort(StaticError.ORDER);
        return merged;
    }
}
