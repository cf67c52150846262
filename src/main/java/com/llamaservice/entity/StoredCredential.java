package com.llamaservice.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * An encrypted access token for one model provider.
 */
@Entity
@Table(name = "credentials")
public class StoredCredential {

    @Id
    @Column(name = "provider", length = 64)
    private String provider;

    @Column(name = "ciphertext", nullable = false, length = 2048)
    private String ciphertext;

    /** Last characters of the plain token, shown in masked form. */
    @Column(name = "hint", length = 8)
    private String hint;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "rotated_at")
    private Instant rotatedAt;

    protected StoredCredential() {
    }

    public StoredCredential(String provider, String ciphertext, String hint) {
        this.provider = provider;
        this.ciphertext = ciphertext;
        this.hint = hint;
        this.createdAt = Instant.now();
    }

    public void rotate(String newCiphertext, String newHint) {
        this.ciphertext = newCiphertext;
        this.hint = newHint;
        this.rotatedAt = Instant.now();
    }

    public String getProvider() {
        return provider;
    }

    public String getCiphertext() {
        return ciphertext;
    }

    public String getHint() {
        return hint;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getRotatedAt() {
        return rotatedAt;
    }
}
