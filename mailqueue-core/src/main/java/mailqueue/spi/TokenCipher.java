package mailqueue.spi;

/**
 * Symmetric encryption for tokens at rest.
 */
public interface TokenCipher {

    String encrypt(String plaintext);

    /**
     * @throws IllegalStateException if the ciphertext is malformed or fails authentication
     */
    String decrypt(String ciphertext);
}
