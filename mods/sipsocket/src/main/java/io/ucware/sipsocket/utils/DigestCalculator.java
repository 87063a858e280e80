/*
 * Copyright (C) 2024 by the ucware-cli authors
 *
 * This file is part of ucware-cli
 *
 * Licensed under the MIT License (the "License");
 * you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 *
 *    https://opensource.org/licenses/MIT
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.ucware.sipsocket.utils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.Map;

/**
 * HTTP digest response computation (RFC 2617 / RFC 7616) without quality of protection.
 *
 * <pre>
 * HA1      = H(username ":" realm ":" password)
 * HA2      = H(method ":" uri)
 * response = H(HA1 ":" nonce ":" HA2)
 * </pre>
 */
public final class DigestCalculator {
  public static final String DEFAULT_ALGORITHM = "MD5";

  private static final Map<String, String> ALGORITHMS = Map.of(
      "MD5", "MD5",
      "SHA-256", "SHA-256",
      "SHA-512-256", "SHA-512/256");

  private DigestCalculator() {
  }

  /**
   * Checks whether a challenge algorithm can be answered. A null algorithm means the default.
   *
   * @param algorithm The algorithm token from the challenge
   * @return True if supported
   */
  public static boolean isSupported(final String algorithm) {
    return algorithm == null || ALGORITHMS.containsKey(algorithm.toUpperCase(Locale.ROOT));
  }

  /**
   * Computes the digest response.
   *
   * @param algorithm The challenge algorithm, null for {@link #DEFAULT_ALGORITHM}
   * @param username The user name
   * @param realm The realm, verbatim from the challenge
   * @param password The password
   * @param method The request method
   * @param uri The digest URI, may be empty
   * @param nonce The nonce, verbatim from the challenge
   * @return The lower-case hex response value
   * @throws IllegalArgumentException if the algorithm is not supported
   */
  public static String compute(final String algorithm, final String username, final String realm,
      final String password, final String method, final String uri, final String nonce) {
    var name = algorithm == null ? DEFAULT_ALGORITHM : algorithm.toUpperCase(Locale.ROOT);
    var jcaName = ALGORITHMS.get(name);
    if (jcaName == null) {
      throw new IllegalArgumentException("unsupported digest algorithm: " + algorithm);
    }

    var ha1 = hash(jcaName, username + ":" + realm + ":" + password);
    var ha2 = hash(jcaName, method + ":" + uri);
    return hash(jcaName, ha1 + ":" + nonce + ":" + ha2);
  }

  private static String hash(final String jcaName, final String value) {
    try {
      var digest = MessageDigest.getInstance(jcaName).digest(value.getBytes(StandardCharsets.UTF_8));
      var hex = new StringBuilder(digest.length * 2);
      for (byte b : digest) {
        hex.append(Character.forDigit((b >> 4) & 0xf, 16)).append(Character.forDigit(b & 0xf, 16));
      }
      return hex.toString();
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("message digest not available: " + jcaName, e);
    }
  }
}
