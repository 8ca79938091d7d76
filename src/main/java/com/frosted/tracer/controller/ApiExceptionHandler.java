package com.frosted.tracer.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Turns request problems and unexpected failures into {@code {success: false, message}}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public AnalysisController.AnalysisResponse badRequest(Exception e) {
        LOGGER.debug("Rejected request: {}", e.getMessage());
        String message = e instanceof HttpMessageNotReadableException ? "Request body is not valid JSON" : e.getMessage();
        return failure(message);
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public AnalysisController.AnalysisResponse unexpected(Exception e) {
        LOGGER.error("Analysis failed", e);
        return failure("Error: " + e.getMessage());
    }

    private static AnalysisController.AnalysisResponse failure(String message) {
        AnalysisController.AnalysisResponse response = new AnalysisController.AnalysisResponse();
        response.setSuccess(false);
        response.setMessage(message);
        return response;
    }
}
