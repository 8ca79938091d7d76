package com.frosted.tracer.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class AnalysisControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void analyzeReturnsTraceForCleanCode() throws Exception {
        mockMvc.perform(post("/api/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\": \"x = 2\\nprint(x * 3)\\n\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.report.language").value("python"))
                .andExpect(jsonPath("$.report.errors", hasSize(0)))
                .andExpect(jsonPath("$.report.simulated").value(true))
                .andExpect(jsonPath("$.report.trace.steps", hasSize(2)))
                .andExpect(jsonPath("$.report.trace.steps[0].number").value(0))
                .andExpect(jsonPath("$.report.trace.steps[0].variables.x.value").value("2"))
                .andExpect(jsonPath("$.report.trace.steps[1].output").value("6\n"))
                .andExpect(jsonPath("$.report.fault").doesNotExist());
    }

    @Test
    void analyzeReportsSyntaxErrors() throws Exception {
        mockMvc.perform(post("/api/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\": \"x = 1\\nprint(x\\n\", \"sessionId\": \"abc\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.report.errors[0].kind").value("UNMATCHED_BRACKET"))
                .andExpect(jsonPath("$.report.errors[0].line").value(2))
                .andExpect(jsonPath("$.report.simulated").value(false))
                .andExpect(jsonPath("$.report.trace").doesNotExist());
    }

    @Test
    void runtimeFaultIsPartOfTheReport() throws Exception {
        mockMvc.perform(post("/api/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\": \"x = 1 / 0\\n\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.report.fault.kind").value("DIVISION_BY_ZERO"))
                .andExpect(jsonPath("$.report.fault.line").value(1))
                .andExpect(jsonPath("$.report.trace.steps", hasSize(1)));
    }

    @Test
    void missingCodeIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"confidence\": 0.9}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("code is required"));
    }

    @Test
    void unknownLanguageIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\": \"x = 1\", \"language\": \"rust\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void malformedJsonIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Request body is not valid JSON"));
    }

    @Test
    void detectReturnsLanguageId() throws Exception {
        mockMvc.perform(post("/api/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\": \"System.out.println(1);\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.language").value("java"));
    }
}
