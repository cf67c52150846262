package com.llamaservice.controller;

import com.llamaservice.service.CredentialService;
import com.llamaservice.service.CredentialService.TokenStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hugging Face token used for gated downloads.
 *
 * GET /api/settings/token returns presence, source and a masked form only.
 * POST /api/settings/token with { "token": "hf_..." } stores it encrypted.
 * DELETE /api/settings/token removes the stored token.
 */
@RestController
@RequestMapping("/api/settings/token")
public class SettingsController {

    private final CredentialService credentials;

    public SettingsController(CredentialService credentials) {
        this.credentials = credentials;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> status() {
        return ResponseEntity.ok(describe(credentials.status()));
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> store(@RequestBody Map<String, String> body) {
        try {
            credentials.storeToken(body.get("token"));
        } catch (IllegalArgumentException e) {
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("error", e.getMessage());
            return ResponseEntity.badRequest().body(error);
        }
        Map<String, Object> response = describe(credentials.status());
        response.put("status", "saved");
        return ResponseEntity.ok(response);
    }

    @DeleteMapping
    public ResponseEntity<Map<String, Object>> clear() {
        boolean removed = credentials.clearToken();
        Map<String, Object> response = describe(credentials.status());
        response.put("status", removed ? "cleared" : "absent");
        return ResponseEntity.ok(response);
    }

    private static Map<String, Object> describe(TokenStatus status) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("hasToken", status.present());
        body.put("source", status.source());
        body.put("tokenMasked", status.masked());
        return body;
    }
}
