package com.llamaservice.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-256-GCM sealing of access tokens at rest.
 *
 * The key is derived from the OS user and host name, so a database copied to
 * another machine cannot be opened there. Sealed values look like
 * {@code v1:<base64(nonce | ciphertext | tag)>}; the prefix is also bound as
 * associated data.
 */
@Service
public class TokenEncryptionService {

    private static final Logger log = LoggerFactory.getLogger(TokenEncryptionService.class);

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final String FORMAT_PREFIX = "v1:";
    private static final int NONCE_BYTES = 12;
    private static final int TAG_BITS = 128;
    private static final String KEY_CONTEXT = "llama-model-service/token-key";

    private final SecureRandom random = new SecureRandom();
    private final SecretKey key;

    public TokenEncryptionService() {
        this(machineIdentity());
    }

    TokenEncryptionService(String identity) {
        this.key = deriveKey(identity);
    }

    public String encrypt(String plaintext) {
        if (plaintext == null || plaintext.isBlank()) {
            throw new IllegalArgumentException("Nothing to encrypt");
        }
        byte[] nonce = new byte[NONCE_BYTES];
        random.nextBytes(nonce);
        try {
            Cipher cipher = cipher(Cipher.ENCRYPT_MODE, nonce);
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            ByteBuffer out = ByteBuffer.allocate(nonce.length + sealed.length).put(nonce).put(sealed);
            return FORMAT_PREFIX + Base64.getEncoder().encodeToString(out.array());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Token encryption failed", e);
        }
    }

    /**
     * Opens a value produced by {@link #encrypt(String)} with the same key.
     *
     * @throws IllegalArgumentException when the value is not in the sealed format
     * @throws IllegalStateException    when it was sealed with another key or tampered with
     */
    public String decrypt(String sealedValue) {
        if (sealedValue == null || !sealedValue.startsWith(FORMAT_PREFIX)) {
            throw new IllegalArgumentException("Not a sealed token");
        }
        ByteBuffer in = ByteBuffer.wrap(Base64.getDecoder().decode(sealedValue.substring(FORMAT_PREFIX.length())));
        if (in.remaining() <= NONCE_BYTES) {
            throw new IllegalArgumentException("Sealed token is truncated");
        }
        byte[] nonce = new byte[NONCE_BYTES];
        in.get(nonce);
        byte[] sealed = new byte[in.remaining()];
        in.get(sealed);
        try {
            return new String(cipher(Cipher.DECRYPT_MODE, nonce).doFinal(sealed), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Token cannot be decrypted with this machine's key", e);
        }
    }

    private Cipher cipher(int mode, byte[] nonce) throws GeneralSecurityException {
        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(mode, key, new GCMParameterSpec(TAG_BITS, nonce));
        cipher.updateAAD(FORMAT_PREFIX.getBytes(StandardCharsets.US_ASCII));
        return cipher;
    }

    static SecretKey deriveKey(String identity) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            sha256.update(KEY_CONTEXT.getBytes(StandardCharsets.UTF_8));
            return new SecretKeySpec(sha256.digest(identity.getBytes(StandardCharsets.UTF_8)), "AES");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String machineIdentity() {
        String user = System.getProperty("user.name", "unknown-user");
        try {
            return user + "@" + InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("Host name lookup failed, key is bound to the user only: {}", e.getMessage());
            return user + "@localhost";
        }
    }
}
