package com.llamaservice.controller;

import com.llamaservice.model.FailureKind;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response envelopes shared by the REST controllers.
 *
 * Success: { "data": ... }
 * Failure: { "error": "message", "failure": "KIND" }
 */
final class ApiResponses {

    private ApiResponses() {
    }

    static ResponseEntity<Map<String, Object>> ok(Object data) {
        return ResponseEntity.ok(envelope(data));
    }

    static ResponseEntity<Map<String, Object>> status(HttpStatus status, Object data) {
        return ResponseEntity.status(status).body(envelope(data));
    }

    static ResponseEntity<Map<String, Object>> failure(FailureKind kind, String error) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error != null ? error : "Unknown error");
        body.put("failure", kind);
        return ResponseEntity.status(httpStatus(kind)).body(body);
    }

    static HttpStatus httpStatus(FailureKind kind) {
        if (kind == null) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return switch (kind) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_REQUEST -> HttpStatus.BAD_REQUEST;
            case NO_ACTIVE_MODEL -> HttpStatus.CONFLICT;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static Map<String, Object> envelope(Object data) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("data", data);
        return body;
    }
}
