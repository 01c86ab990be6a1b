/*-
 * -\-\-
 * Spotify Sluice Common
 * --
 * Copyright (C) 2016 Spotify AB
 * --
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * -/-/-
 */

package com.spotify.sluice.crypto;

import com.google.common.io.BaseEncoding;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Objects;
import javax.crypto.Cipher;
import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * Encrypts secrets at rest with AES-GCM. Ciphertexts are base64 encoded as
 * {@code iv || ciphertext+tag}.
 */
public class SecretCipher {

  private static final String TRANSFORMATION = "AES/GCM/NoPadding";
  private static final int IV_LENGTH = 12;
  private static final int TAG_LENGTH_BITS = 128;

  private final SecretKey key;
  private final SecureRandom random;

  SecretCipher(SecretKey key, SecureRandom random) {
    this.key = Objects.requireNonNull(key);
    this.random = Objects.requireNonNull(random);
  }

  /**
   * Create a cipher from a base64 encoded 128, 192 or 256 bit AES key.
   */
  public static SecretCipher fromBase64Key(String base64Key) {
    final byte[] keyBytes = BaseEncoding.base64().decode(base64Key.trim());
    if (keyBytes.length != 16 && keyBytes.length != 24 && keyBytes.length != 32) {
      throw new IllegalArgumentException("Invalid AES key length: " + keyBytes.length);
    }
    return new SecretCipher(new SecretKeySpec(keyBytes, "AES"), new SecureRandom());
  }

  public static String generateBase64Key() {
    try {
      final KeyGenerator generator = KeyGenerator.getInstance("AES");
      generator.init(256);
      return BaseEncoding.base64().encode(generator.generateKey().getEncoded());
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("AES is not available", e);
    }
  }

  public String encrypt(String plaintext) {
    final byte[] iv = new byte[IV_LENGTH];
    random.nextBytes(iv);
    try {
      final Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
      final byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
      return BaseEncoding.base64().encode(
          ByteBuffer.allocate(iv.length + ciphertext.length).put(iv).put(ciphertext).array());
    } catch (GeneralSecurityException e) {
      throw new SecretCipherException("Failed to encrypt secret", e);
    }
  }

  /**
   * @throws SecretCipherException if the ciphertext is malformed or was encrypted with another key
   */
  public String decrypt(String encoded) {
    final byte[] bytes;
    try {
      bytes = BaseEncoding.base64().decode(encoded);
    } catch (IllegalArgumentException e) {
      throw new SecretCipherException("Secret is not valid base64", e);
    }
    if (bytes.length <= IV_LENGTH) {
      throw new SecretCipherException("Secret is too short", null);
    }
    try {
      final Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, bytes, 0, IV_LENGTH));
      final byte[] plaintext = cipher.doFinal(bytes, IV_LENGTH, bytes.length - IV_LENGTH);
      return new String(plaintext, StandardCharsets.UTF_8);
    } catch (GeneralSecurityException e) {
      throw new SecretCipherException("Failed to decrypt secret", e);
    }
  }

  public static class SecretCipherException extends RuntimeException {

    public SecretCipherException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
