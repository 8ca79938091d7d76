package com.frosted.tracer.service;

import com.frosted.tracer.CodeTracer;
import com.frosted.tracer.config.TracerProperties;
import com.frosted.tracer.model.AnalysisReport;
import com.frosted.tracer.model.CapturedText;
import com.frosted.tracer.model.Language;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs captures through the tracer, filling in the configured confidence threshold and the
 * session's previous language.
 */
@Service
public class AnalysisService {
    private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisService.class);

    private final CodeTracer tracer;
    private final TracerProperties properties;
    private final SessionLanguageMemory sessions;

    public AnalysisService(CodeTracer tracer, TracerProperties properties, SessionLanguageMemory sessions) {
        this.tracer = tracer;
        this.properties = properties;
        this.sessions = sessions;
    }

    /**
     * @param confidence recognition confidence in [0, 1], or {@code null} for typed code
     * @param sessionId  learner session, may be {@code null}
     * @param language   wire id of a language chosen by the learner, may be {@code null}
     */
    public AnalysisReport analyze(String code, Double confidence, String sessionId, String language) {
        if (code == null) {
            throw new IllegalArgumentException("code is required");
        }
        if (confidence != null && (confidence < 0 || confidence > 1 || confidence.isNaN())) {
            throw new IllegalArgumentException("confidence must be between 0 and 1");
        }
        Language chosen = parseLanguage(language);
        CapturedText capture = confidence == null ? CapturedText.typed(code) : new CapturedText(code, confidence);

        AnalysisReport report = chosen != null
                ? tracer.analyze(capture, properties.getMinConfidence(), chosen, false)
                : tracer.analyze(capture, properties.getMinConfidence(), sessions.get(sessionId), true);
        sessions.remember(sessionId, report.getLanguage());
        LOGGER.debug("Session {} analyzed as {}", sessionId, report.getLanguage());
        return report;
    }

    public Language detect(String code, String sessionId) {
        if (code == null) {
            throw new IllegalArgumentException("code is required");
        }
        Language language = tracer.detectLanguage(code, sessions.get(sessionId));
        sessions.remember(sessionId, language);
        return language;
    }

    private static Language parseLanguage(String language) {
        if (language == null || language.isBlank()) {
            return null;
        }
        Language parsed = Language.fromId(language);
        if (parsed == null) {
            throw new IllegalArgumentException("Unknown language '" + language + "', use python, javascript or java");
        }
        return parsed;
    }
}
