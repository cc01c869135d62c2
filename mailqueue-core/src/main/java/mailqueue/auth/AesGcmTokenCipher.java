package mailqueue.auth;

import mailqueue.spi.TokenCipher;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * AES-256-GCM token encryption.
 *
 * <p>The key is derived from a passphrase with PBKDF2-HMAC-SHA512 (100,000 iterations) using the
 * first 16 bytes of {@code SHA-256(passphrase + "-salt")} as salt. Ciphertext is stored as
 * {@code base64(iv[16] || tag[16] || ciphertext)}.
 */
public final class AesGcmTokenCipher implements TokenCipher {
  private static final int IV_LENGTH = 16;
  private static final int TAG_LENGTH = 16;
  private static final int KEY_BITS = 256;
  private static final int ITERATIONS = 100_000;

  private final SecretKey key;
  private final SecureRandom random = new SecureRandom();

  /**
   * @throws IllegalStateException if the passphrase is missing
   */
  public AesGcmTokenCipher(String passphrase) {
    if (passphrase == null || passphrase.isEmpty()) {
      throw new IllegalStateException("Token encryption key is not configured");
    }
    this.key = deriveKey(passphrase);
  }

  @Override
  public String encrypt(String plaintext) {
    byte[] iv = new byte[IV_LENGTH];
    random.nextBytes(iv);
    try {
      Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
      cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH * 8, iv));
      // JCE appends the tag to the ciphertext
      byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
      int ciphertextLength = sealed.length - TAG_LENGTH;
      ByteBuffer out = ByteBuffer.allocate(IV_LENGTH + sealed.length);
      out.put(iv);
      out.put(sealed, ciphertextLength, TAG_LENGTH);
      out.put(sealed, 0, ciphertextLength);
      return Base64.getEncoder().encodeToString(out.array());
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Token encryption failed", e);
    }
  }

  @Override
  public String decrypt(String ciphertext) {
    byte[] data;
    try {
      data = Base64.getDecoder().decode(ciphertext);
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException("Token ciphertext is not valid base64", e);
    }
    if (data.length < IV_LENGTH + TAG_LENGTH) {
      throw new IllegalStateException("Token ciphertext is too short");
    }
    byte[] iv = Arrays.copyOfRange(data, 0, IV_LENGTH);
    byte[] tag = Arrays.copyOfRange(data, IV_LENGTH, IV_LENGTH + TAG_LENGTH);
    byte[] body = Arrays.copyOfRange(data, IV_LENGTH + TAG_LENGTH, data.length);
    byte[] sealed = new byte[body.length + TAG_LENGTH];
    System.arraycopy(body, 0, sealed, 0, body.length);
    System.arraycopy(tag, 0, sealed, body.length, TAG_LENGTH);
    try {
      Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
      cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH * 8, iv));
      return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Token decryption failed", e);
    }
  }

  private static SecretKey deriveKey(String passphrase) {
    try {
      byte[] digest = MessageDigest.getInstance("SHA-256")
          .digest((passphrase + "-salt").getBytes(StandardCharsets.UTF_8));
      byte[] salt = Arrays.copyOf(digest, 16);
      PBEKeySpec spec = new PBEKeySpec(passphrase.toCharArray(), salt, ITERATIONS, KEY_BITS);
      try {
        byte[] keyBytes = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA512").generateSecret(spec).getEncoded();
        return new SecretKeySpec(keyBytes, "AES");
      } finally {
        spec.clearPassword();
      }
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Cannot derive token encryption key", e);
    }
  }
}
