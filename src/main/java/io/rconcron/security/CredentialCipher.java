package io.rconcron.security;

/**
 * Symmetric cipher used to keep stored server credentials unreadable at rest.
 */
public interface CredentialCipher {
    String encrypt(String plaintext) throws CryptoException;

    /**
     * @throws CryptoException when the ciphertext is malformed or no key can open it;
     *                         callers treat this as "credential unavailable"
     */
    String decrypt(String ciphertext) throws CryptoException;
}
