package com.llamaservice.service;

import org.junit.jupiter.api.Test;

import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenEncryptionServiceTest {

    @Test
    void encryptedTokenDecryptsOnTheSameMachine() {
        TokenEncryptionService service = new TokenEncryptionService("alice:laptop");

        String encrypted = service.encrypt("hf_abcdefghijklmnop");

        assertThat(encrypted).doesNotContain("hf_abcdefghijklmnop");
        assertThat(service.decrypt(encrypted)).isEqualTo("hf_abcdefghijklmnop");
    }

    @Test
    void eachEncryptionUsesAFreshIv() {
        TokenEncryptionService service = new TokenEncryptionService("alice:laptop");

        assertThat(service.encrypt("hf_token_value")).isNotEqualTo(service.encrypt("hf_token_value"));
    }

    @Test
    void tokenFromAnotherMachineCannotBeDecrypted() {
        String encrypted = new TokenEncryptionService("alice:laptop").encrypt("hf_token_value");

        assertThatThrownBy(() -> new TokenEncryptionService("bob:server").decrypt(encrypted))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void blankInputIsRejected() {
        TokenEncryptionService service = new TokenEncryptionService("alice:laptop");

        assertThatThrownBy(() -> service.encrypt(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.decrypt("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.decrypt("AAAA")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void sealedValuesCarryAFormatPrefix() {
        TokenEncryptionService service = new TokenEncryptionService("alice@laptop");

        assertThat(service.encrypt("hf_token_value")).startsWith("v1:");
        assertThatThrownBy(() -> service.decrypt("v1:AAAA")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void tamperedCiphertextIsRejected() {
        TokenEncryptionService service = new TokenEncryptionService("alice@laptop");
        byte[] raw = Base64.getDecoder().decode(service.encrypt("hf_token_value").substring(3));
        raw[raw.length - 1] ^= 0x01;

        String tampered = "v1:" + Base64.getEncoder().encodeToString(raw);

        assertThatThrownBy(() -> service.decrypt(tampered)).isInstanceOf(IllegalStateException.class);
    }
}
