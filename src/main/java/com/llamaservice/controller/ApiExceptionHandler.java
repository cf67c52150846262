package com.llamaservice.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps request errors to RFC 7807 problem details.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException e) {
        ProblemDetail pd = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
        pd.setTitle("validation_failed");
        pd.setDetail("Request validation failed");

        Map<String, String> fields = new LinkedHashMap<>();
        for (FieldError fe : e.getBindingResult().getFieldErrors()) {
            fields.put(fe.getField(), fe.getDefaultMessage());
        }
        pd.setProperty("fields", fields);

        log.info("Rejected request: validation failed for {}", fields.keySet());
        return pd;
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleBadJson(HttpMessageNotReadableException e) {
        ProblemDetail pd = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
        pd.setTitle("malformed_json");
        pd.setDetail("Malformed JSON request body");

        log.info("Rejected request: malformed JSON");
        return pd;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpected(Exception e) {
        // Spring MVC errors such as an unknown route carry their own status
        if (e instanceof ErrorResponse errorResponse) {
            ProblemDetail pd = errorResponse.getBody();
            if (pd.getStatus() >= 500) {
                log.error("Request failed with status {}: {}", pd.getStatus(), pd.getTitle(), e);
            } else {
                log.info("Request rejected with status {}: {}", pd.getStatus(), pd.getTitle());
            }
            return pd;
        }

        ProblemDetail pd = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
        pd.setTitle("internal_error");
        pd.setDetail("Unexpected server error");

        log.error("Unexpected error while handling request", e);
        return pd;
    }
}
