package com.llamaservice.service;

import com.llamaservice.config.AppConfig;
import com.llamaservice.entity.StoredCredential;
import com.llamaservice.repository.CredentialRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Hugging Face access token used for gated downloads.
 *
 * A token saved through the API is stored encrypted and takes precedence over
 * {@code app.hf-token}. Plain tokens are never logged or returned.
 */
@Service
@Transactional
public class CredentialService {

    private static final Logger log = LoggerFactory.getLogger(CredentialService.class);

    static final String HUGGING_FACE = "huggingface";
    private static final int HINT_LENGTH = 4;
    private static final int MIN_LENGTH = 8;

    public enum Source {
        STORED, CONFIGURED, NONE
    }

    /**
     * What the API may reveal about the current token.
     *
     * @param source where {@link #resolveToken()} would take it from
     * @param masked masked form, empty when there is no token
     */
    public record TokenStatus(Source source, String masked) {

        public boolean present() {
            return source != Source.NONE;
        }
    }

    private final CredentialRepository repository;
    private final TokenEncryptionService encryption;
    private final AppConfig appConfig;

    public CredentialService(CredentialRepository repository, TokenEncryptionService encryption,
            AppConfig appConfig) {
        this.repository = repository;
        this.encryption = encryption;
        this.appConfig = appConfig;
    }

    /**
     * @throws IllegalArgumentException when the token is blank or too short
     */
    public void storeToken(String plainToken) {
        String token = plainToken == null ? "" : plainToken.trim();
        if (token.isEmpty()) {
            throw new IllegalArgumentException("Token cannot be empty");
        }
        if (token.length() < MIN_LENGTH) {
            throw new IllegalArgumentException("Token does not look like a valid Hugging Face token");
        }
        String ciphertext = encryption.encrypt(token);
        String hint = hintOf(token);
        Optional<StoredCredential> existing = repository.findById(HUGGING_FACE);
        if (existing.isPresent()) {
            existing.get().rotate(ciphertext, hint);
            repository.save(existing.get());
            log.info("Hugging Face token replaced");
        } else {
            repository.save(new StoredCredential(HUGGING_FACE, ciphertext, hint));
            log.info("Hugging Face token stored");
        }
    }

    /**
     * @return true if a stored token was removed
     */
    public boolean clearToken() {
        if (!repository.existsById(HUGGING_FACE)) {
            return false;
        }
        repository.deleteById(HUGGING_FACE);
        log.info("Hugging Face token removed");
        return true;
    }

    /**
     * The stored token if it decrypts on this machine, else the configured one.
     */
    @Transactional(readOnly = true)
    public Optional<String> resolveToken() {
        Optional<String> stored = repository.findById(HUGGING_FACE).flatMap(this::decrypt);
        return stored.isPresent() ? stored : configuredToken();
    }

    @Transactional(readOnly = true)
    public TokenStatus status() {
        Optional<StoredCredential> stored = repository.findById(HUGGING_FACE);
        if (stored.isPresent()) {
            return new TokenStatus(Source.STORED, mask(stored.get().getHint()));
        }
        return configuredToken()
                .map(t -> new TokenStatus(Source.CONFIGURED, mask(hintOf(t))))
                .orElse(new TokenStatus(Source.NONE, ""));
    }

    private Optional<String> decrypt(StoredCredential credential) {
        try {
            return Optional.of(encryption.decrypt(credential.getCiphertext()));
        } catch (IllegalStateException | IllegalArgumentException e) {
            log.error("Stored Hugging Face token cannot be decrypted on this machine, save it again: {}",
                    e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<String> configuredToken() {
        String configured = appConfig.getHfToken();
        return configured == null || configured.isBlank() ? Optional.empty() : Optional.of(configured.trim());
    }

    private static String hintOf(String token) {
        return token.length() <= HINT_LENGTH ? "" : token.substring(token.length() - HINT_LENGTH);
    }

    private static String mask(String hint) {
        return "hf_****" + (hint == null ? "" : hint);
    }
}
