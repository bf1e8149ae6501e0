package com.portfolio.mirror.service.credential;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.encrypt.Encryptors;
import org.springframework.security.crypto.encrypt.TextEncryptor;
import org.springframework.stereotype.Component;

/**
 * Encrypts token values before they are stored (AES-GCM, key derived from the configured password and hex salt).
 */
@Component
public class TokenCipher {

    private final TextEncryptor encryptor;

    public TokenCipher(@Value("${portfolio.security.encryption-password:change-me-before-production}") String password,
                       @Value("${portfolio.security.encryption-salt:5c0744940b5c369b}") String hexSalt) {
        this.encryptor = Encryptors.delux(password, hexSalt);
    }

    public String encrypt(String plaintext) {
        return encryptor.encrypt(plaintext);
    }

    public String decrypt(String ciphertext) {
        return ciphertext == null ? null : encryptor.decrypt(ciphertext);
    }
}
