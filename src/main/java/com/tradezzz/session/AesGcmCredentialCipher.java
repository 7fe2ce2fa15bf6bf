package com.tradezzz.session;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * AES-256-GCM cipher for stored exchange secrets.
 *
 * <p>The key is derived from {@code tradezzz.security.credential-key} with PBKDF2-HMAC-SHA256 over a
 * fixed salt. Ciphertexts are {@code Base64(iv[16] || ciphertext || tag[16])}.
 */
@Component
public class AesGcmCredentialCipher implements CredentialCipher {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final byte[] SALT = "tradezzz-salt".getBytes(StandardCharsets.UTF_8);
    private static final int KEY_BITS = 256;
    private static final int KDF_ITERATIONS = 65_536;
    private static final int IV_BYTES = 16;
    private static final int TAG_BITS = 128;
    private static final SecureRandom RNG = new SecureRandom();

    private final SecretKey secretKey;

    public AesGcmCredentialCipher(@Value("${tradezzz.security.credential-key}") String passphrase) {
        if (passphrase == null || passphrase.isBlank()) {
            throw new IllegalStateException("tradezzz.security.credential-key must be configured");
        }
        this.secretKey = deriveKey(passphrase);
    }

    @Override
    public String encrypt(String plaintext) {
        try {
            byte[] iv = new byte[IV_BYTES];
            RNG.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(TAG_BITS, iv));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            byte[] payload = new byte[iv.length + sealed.length];
            System.arraycopy(iv, 0, payload, 0, iv.length);
            System.arraycopy(sealed, 0, payload, iv.length, sealed.length);
            return Base64.getEncoder().encodeToString(payload);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt credential", e);
        }
    }

    @Override
    public String decrypt(String ciphertext) {
        try {
            byte[] payload = Base64.getDecoder().decode(ciphertext);
            if (payload.length < IV_BYTES + TAG_BITS / 8) {
                throw new IllegalStateException("Encrypted credential is too short");
            }
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(TAG_BITS, payload, 0, IV_BYTES));
            byte[] plain = cipher.doFinal(payload, IV_BYTES, payload.length - IV_BYTES);
            return new String(plain, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed to decrypt credential", e);
        }
    }

    private static SecretKey deriveKey(String passphrase) {
        try {
            SecretKeyFactory factory = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256");
            PBEKeySpec spec = new PBEKeySpec(passphrase.toCharArray(), SALT, KDF_ITERATIONS, KEY_BITS);
            return new SecretKeySpec(factory.generateSecret(spec).getEncoded(), "AES");
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to derive credential key", e);
        }
    }
}
