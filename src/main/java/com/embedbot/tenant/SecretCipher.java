package com.embedbot.tenant;

/**
 * Encryption of secrets at rest. Ciphertext is a printable string suitable for a text column.
 */
public interface SecretCipher {

    String encrypt(String plaintext);

    String decrypt(String ciphertext) throws DecryptionFailedException;
}
