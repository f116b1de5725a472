package com.example.rdsbroker.core.credentials;

import com.example.rdsbroker.core.errors.DecryptionFailedException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Locale;
import java.util.Objects;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * Derives user names, generates passwords and encrypts engine state.
 *
 * <p>{@link #username} is a compatibility contract: users created under an older derivation can no
 * longer be found if it changes. {@link #legacyUsername} is the derivation used before it, still
 * needed to drop old bindings.
 *
 * <p>State is sealed with AES-256-GCM under {@code SHA-256(stateEncryptionKey)}. The output is
 * {@code base64url(nonce || ciphertext || tag)} with a fresh 12 byte nonce per call.
 */
public final class CredentialVault {

  static final int USERNAME_LENGTH = 16;
  static final int PASSWORD_LENGTH = 32;

  private static final String ALPHA = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz";
  private static final String ALPHANUMERIC = ALPHA + "0123456789";
  private static final int NONCE_BYTES = 12;
  private static final int TAG_BITS = 128;

  private final SecretKeySpec key;
  private final SecureRandom random;

  public CredentialVault(final String stateEncryptionKey) {
    this(stateEncryptionKey, new SecureRandom());
  }

  CredentialVault(final String stateEncryptionKey, final SecureRandom random) {
    Objects.requireNonNull(stateEncryptionKey, "stateEncryptionKey");
    if (stateEncryptionKey.isEmpty())
      throw new IllegalArgumentException("stateEncryptionKey must not be empty");
    this.key = new SecretKeySpec(digest("SHA-256", stateEncryptionKey), "AES");
    this.random = Objects.requireNonNull(random, "random");
  }

  /** {@code "u"} followed by 15 lower-cased base64url characters of SHA-256(bindingId). */
  public static String username(final String bindingId) {
    return "u" + hashedName("SHA-256", bindingId);
  }

  /** The MD5 based derivation used by older releases. */
  public static String legacyUsername(final String bindingId) {
    return "u" + hashedName("MD5", bindingId);
  }

  /**
   * Deterministic secret of at most {@code maxLength} base64url characters of SHA-256(text). Used
   * to derive master passwords from a seed and an instance identifier.
   */
  public static String derive(final String text, final int maxLength) {
    final var encoded = Base64.getUrlEncoder().encodeToString(digest("SHA-256", text));
    return encoded.length() > maxLength ? encoded.substring(0, maxLength) : encoded;
  }

  /** Fresh 32 character password: one letter followed by letters and digits. */
  public String password() {
    final var sb = new StringBuilder(PASSWORD_LENGTH);
    sb.append(ALPHA.charAt(random.nextInt(ALPHA.length())));
    for (var i = 1; i < PASSWORD_LENGTH; i++) {
      sb.append(ALPHANUMERIC.charAt(random.nextInt(ALPHANUMERIC.length())));
    }
    return sb.toString();
  }

  public String encrypt(final String plaintext) {
    Objects.requireNonNull(plaintext, "plaintext");
    final var nonce = new byte[NONCE_BYTES];
    random.nextBytes(nonce);
    try {
      final var cipher = Cipher.getInstance("AES/GCM/NoPadding");
      cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, nonce));
      final var sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
      final var out = ByteBuffer.allocate(nonce.length + sealed.length).put(nonce).put(sealed);
      return Base64.getUrlEncoder().encodeToString(out.array());
    } catch (final GeneralSecurityException e) {
      throw new IllegalStateException("AES-GCM unavailable", e);
    }
  }

  /**
   * Opens a value produced by {@link #encrypt}.
   *
   * @throws DecryptionFailedException when the key is wrong or the value was altered
   */
  public String decrypt(final String ciphertext) {
    Objects.requireNonNull(ciphertext, "ciphertext");
    final byte[] raw;
    try {
      raw = Base64.getUrlDecoder().decode(ciphertext);
    } catch (final IllegalArgumentException e) {
      throw new DecryptionFailedException("ciphertext is not base64url", e);
    }
    if (raw.length < NONCE_BYTES + TAG_BITS / 8) {
      throw new DecryptionFailedException("ciphertext too short", null);
    }
    try {
      final var cipher = Cipher.getInstance("AES/GCM/NoPadding");
      cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, raw, 0, NONCE_BYTES));
      final var plain = cipher.doFinal(raw, NONCE_BYTES, raw.length - NONCE_BYTES);
      return new String(plain, StandardCharsets.UTF_8);
    } catch (final AEADBadTagException e) {
      throw new DecryptionFailedException("message authentication failed", e);
    } catch (final GeneralSecurityException e) {
      throw new IllegalStateException("AES-GCM unavailable", e);
    }
  }

  private static String hashedName(final String algorithm, final String bindingId) {
    final var encoded = Base64.getUrlEncoder().encodeToString(digest(algorithm, bindingId));
    final var truncated =
        encoded.length() > USERNAME_LENGTH - 1 ? encoded.substring(0, USERNAME_LENGTH - 1) : encoded;
    return truncated.toLowerCase(Locale.ROOT).replace('-', '_');
  }

  private static byte[] digest(final String algorithm, final String text) {
    try {
      return MessageDigest.getInstance(algorithm).digest(text.getBytes(StandardCharsets.UTF_8));
    } catch (final NoSuchAlgorithmException e) {
      throw new IllegalStateException(algorithm + " unavailable", e);
    }
  }
}
