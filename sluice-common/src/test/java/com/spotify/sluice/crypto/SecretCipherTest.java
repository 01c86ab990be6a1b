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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertThrows;

import com.google.common.io.BaseEncoding;
import com.spotify.sluice.crypto.SecretCipher.SecretCipherException;
import org.junit.Test;

public class SecretCipherTest {

  private final SecretCipher cipher = SecretCipher.fromBase64Key(SecretCipher.generateBase64Key());

  @Test
  public void shouldDecryptWhatItEncrypted() {
    final String encrypted = cipher.encrypt("refresh-token-value");

    assertThat(encrypted, not(is("refresh-token-value")));
    assertThat(cipher.decrypt(encrypted), is("refresh-token-value"));
  }

  @Test
  public void shouldUseFreshIvPerEncryption() {
    assertThat(cipher.encrypt("secret"), not(is(cipher.encrypt("secret"))));
  }

  @Test
  public void shouldRejectSecretFromOtherKey() {
    final SecretCipher other = SecretCipher.fromBase64Key(SecretCipher.generateBase64Key());
    final String encrypted = other.encrypt("secret");

    assertThrows(SecretCipherException.class, () -> cipher.decrypt(encrypted));
  }

  @Test
  public void shouldRejectTamperedSecret() {
    final byte[] bytes = BaseEncoding.base64().decode(cipher.encrypt("secret"));
    bytes[bytes.length - 1] ^= 1;
    final String tampered = BaseEncoding.base64().encode(bytes);

    assertThrows(SecretCipherException.class, () -> cipher.decrypt(tampered));
  }

  @Test
  public void shouldRejectGarbage() {
    assertThrows(SecretCipherException.class, () -> cipher.decrypt("not base64 !"));
    assertThrows(SecretCipherException.class, () -> cipher.decrypt("AAAA"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void shouldRejectInvalidKeyLength() {
    SecretCipher.fromBase64Key("AAAAAAAA");
  }
}
