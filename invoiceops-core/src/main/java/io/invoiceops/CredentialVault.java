package io.invoiceops;

/**
 * Encrypts credential blobs at rest.
 */
public interface CredentialVault {

    String encrypt(String plaintext);

    /**
     * @throws io.invoiceops.exception.CredentialException when the ciphertext cannot be decrypted
     */
    String decrypt(String ciphertext);
}
