package com.frosted.tracer.controller;

import com.frosted.tracer.model.AnalysisReport;
import com.frosted.tracer.model.Language;
import com.frosted.tracer.service.AnalysisService;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API controller for code analysis
 */
@RestController
@RequestMapping("/api")
public class AnalysisController {

    private final AnalysisService analysisService;

    public AnalysisController(AnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @PostMapping("/analyze")
    public AnalysisResponse analyze(@RequestBody AnalysisRequest request) {
        AnalysisReport report = analysisService.analyze(request.getCode(), request.getConfidence(),
                request.getSessionId(), request.getLanguage());
        AnalysisResponse response = new AnalysisResponse();
        response.setSuccess(true);
        response.setReport(report);
        return response;
    }

    @PostMapping("/detect")
    public DetectResponse detect(@RequestBody DetectRequest request) {
        Language language = analysisService.detect(request.getCode(), request.getSessionId());
        DetectResponse response = new DetectResponse();
        response.setLanguage(language);
        return response;
    }

    // Request/Response classes
    public static class AnalysisRequest {
        private String code;
        private Double confidence;
        private String sessionId;
        private String language;

        public String getCode() { return code; }
        public void setCode(String code) { this.code = code; }
        public Double getConfidence() { return confidence; }
        public void setConfidence(Double confidence) { this.confidence = confidence; }
        public String getSessionId() { return sessionId; }
        public void setSessionId(String sessionId) { this.sessionId = sessionId; }
        public String getLanguage() { return language; }
        public void setLanguage(String language) { this.language = language; }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class AnalysisResponse {
        private boolean success;
        private String message;
        private AnalysisReport report;

        public boolean isSuccess() { return success; }
        public void setSuccess(boolean success) { this.success = success; }
        public String getMessage() { return message; }
        public void setMessage(String message) { this.message = message; }
        public AnalysisReport getReport() { return report; }
        public void setReport(AnalysisReport report) { this.report = report; }
    }

    public static class DetectRequest {
        private String code;
        private String sessionId;

        public String getCode() { return code; }
        public void setCode(String code) { this.code = code; }
        public String getSessionId() { return sessionId; }
        public void setSessionId(String sessionId) { this.sessionId = sessionId; }
    }

    public static class DetectResponse {
        private Language language;

        public Language getLanguage() { return language; }
        public void setLanguage(Language language) { this.language = language; }
    }
}
