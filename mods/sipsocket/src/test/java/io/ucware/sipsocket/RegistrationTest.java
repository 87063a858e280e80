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
package io.ucware.sipsocket;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sip.header.WWWAuthenticateHeader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.*;

public class RegistrationTest {
  private static final String CHALLENGE =
      "WWW-Authenticate: Digest realm=\"example.com\", nonce=\"abc\", algorithm=MD5";

  private LoopbackTransport loopback;
  private Connection connection;
  private final List<String> registers = new ArrayList<>();

  @BeforeEach
  public void setUp() throws Exception {
    loopback = new LoopbackTransport();
    connection = Connection.connect(URI.create("wss://pbx.example.com:8443/sipsockets/"), "u", loopback);
  }

  @AfterEach
  public void tearDown() {
    connection.close();
  }

  /**
   * Plays the registrar: each REGISTER written is answered with the next reply.
   */
  @SafeVarargs
  private void answer(final UnaryOperator<String>... replies) {
    loopback.onSend(text -> {
      var round = registers.size();
      registers.add(text);
      if (round < replies.length) {
        loopback.deliver(replies[round].apply(text));
      }
    });
  }

  private void register() throws Exception {
    assertTimeoutPreemptively(Duration.ofSeconds(10), () -> connection.register("u", "p"));
  }

  private static String md5(final String value) throws Exception {
    var digest = MessageDigest.getInstance("MD5").digest(value.getBytes(StandardCharsets.UTF_8));
    return HexFormat.of().formatHex(digest);
  }

  @Test
  public void testChallengeIsAnswered() throws Exception {
    answer(
        text -> SipFixtures.response(text, 401, "Unauthorized", CHALLENGE),
        text -> SipFixtures.response(text, 200, "OK"));

    register();

    assertEquals(2, registers.size());
    var first = registers.get(0);
    var second = registers.get(1);

    assertTrue(second.startsWith("REGISTER sip:pbx.example.com SIP/2.0"));
    assertEquals(SipFixtures.header(first, "Call-ID"), SipFixtures.header(second, "Call-ID"));
    var firstSeq = Long.parseLong(SipFixtures.header(first, "CSeq").split(" ")[0]);
    assertEquals((firstSeq + 1) + " REGISTER", SipFixtures.header(second, "CSeq"));

    var contact = SipFixtures.header(second, "Contact");
    assertTrue(contact.contains("@" + connection.getSendBy()), contact);
    assertTrue(contact.contains("transport=ws"), contact);
    assertTrue(contact.contains("expires=6000"), contact);

    var expected = md5(md5("u:example.com:p") + ":abc:" + md5("REGISTER:"));
    var authorization = SipFixtures.header(second, "Authorization");
    assertTrue(authorization.startsWith("Digest "), authorization);
    assertTrue(authorization.contains("username=\"u\""), authorization);
    assertTrue(authorization.contains("realm=\"example.com\""), authorization);
    assertTrue(authorization.contains("nonce=\"abc\""), authorization);
    assertTrue(authorization.contains("uri=\"\""), authorization);
    assertTrue(authorization.contains("response=\"" + expected + "\""), authorization);
    assertFalse(authorization.contains("qop"), authorization);
  }

  @Test
  public void testFirstRoundCarriesNoCredentials() throws Exception {
    answer(text -> SipFixtures.response(text, 200, "OK"));

    register();

    assertEquals(1, registers.size());
    assertFalse(registers.get(0).contains("Authorization:"));
    assertFalse(registers.get(0).contains("Contact:"));
  }

  @Test
  public void testRejectionFailsWithStatus() {
    answer(text -> SipFixtures.response(text, 403, "Forbidden"));

    var e = assertThrows(RegistrationException.class, () -> connection.register("u", "p"));
    assertEquals(403, e.getStatusCode());
    assertEquals("failed to register: 403", e.getMessage());
  }

  @Test
  public void testRejectedCredentialsFailWithStatus() {
    answer(
        text -> SipFixtures.response(text, 401, "Unauthorized", CHALLENGE),
        text -> SipFixtures.response(text, 401, "Unauthorized", CHALLENGE));

    var e = assertThrows(RegistrationException.class, () -> connection.register("u", "wrong"));
    assertEquals(401, e.getStatusCode());
    assertEquals(2, registers.size());
  }

  @Test
  public void testChallengeWithoutAuthenticateHeader() {
    answer(text -> SipFixtures.response(text, 401, "Unauthorized"));

    var e = assertThrows(MissingHeaderException.class, () -> connection.register("u", "p"));
    assertEquals(WWWAuthenticateHeader.NAME, e.getHeaderName());
    assertEquals(1, registers.size());
  }

  @Test
  public void testUnsupportedAlgorithmIsRefused() {
    answer(text -> SipFixtures.response(text, 401, "Unauthorized",
        "WWW-Authenticate: Digest realm=\"example.com\", nonce=\"abc\", algorithm=MD5-sess"));

    var e = assertThrows(RegistrationException.class, () -> connection.register("u", "p"));
    assertEquals(401, e.getStatusCode());
    assertEquals(1, registers.size());
  }

  @Test
  public void testSha256ChallengeEchoesAlgorithmAndOpaque() throws Exception {
    answer(
        text -> SipFixtures.response(text, 401, "Unauthorized",
            "WWW-Authenticate: Digest realm=\"example.com\", nonce=\"abc\", algorithm=SHA-256, opaque=\"xyz\""),
        text -> SipFixtures.response(text, 200, "OK"));

    register();

    var authorization = SipFixtures.header(registers.get(1), "Authorization");
    assertTrue(authorization.contains("algorithm=SHA-256"), authorization);
    assertTrue(authorization.contains("opaque=\"xyz\""), authorization);
  }
}
