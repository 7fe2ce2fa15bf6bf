package com.tradezzz.session;

/**
 * Symmetric encryption of exchange secrets at rest.
 */
public interface CredentialCipher {

    String encrypt(String plaintext);

    /**
     * @throws IllegalStateException if the ciphertext was not produced with the current key
     */
    String decrypt(String ciphertext);
}
