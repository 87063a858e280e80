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

import javax.sip.header.CSeqHeader;
import javax.sip.message.Request;
import javax.sip.message.Response;
import java.io.IOException;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class ConnectionTest {
  private static final URI URL = URI.create("wss://pbx.example.com:8443/sipsockets/");
  private LoopbackTransport loopback;
  private Connection connection;

  @BeforeEach
  public void setUp() throws Exception {
    loopback = new LoopbackTransport();
    connection = Connection.connect(URL, "alice", loopback);
  }

  @AfterEach
  public void tearDown() {
    connection.close();
  }

  private void awaitClosed() throws InterruptedException {
    for (int i = 0; i < 100 && (connection.isOpen() || !loopback.isClosed()); i++) {
      Thread.sleep(50);
    }
    assertFalse(connection.isOpen());
    assertTrue(loopback.isClosed());
  }

  @Test
  public void testIdentity() {
    assertEquals(URL, connection.getUrl());
    assertEquals("pbx.example.com", connection.getDomain());
    assertEquals("sip:alice@pbx.example.com", connection.getUser().toString());
    assertTrue(connection.getSendBy().matches("[a-z0-9]{16}\\.invalid"));
    assertTrue(connection.isOpen());
  }

  @Test
  public void testUrlWithoutHostIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> Connection.connect(URI.create("file:///tmp/socket"), "alice", new LoopbackTransport()));
  }

  @Test
  public void testPingIsAnsweredWithSamePayload() throws Exception {
    var payload = ByteBuffer.wrap("keepalive".getBytes(StandardCharsets.UTF_8));

    loopback.ping(payload);

    assertEquals(payload, loopback.nextPong());
  }

  @Test
  public void testAcceptReturnsInboundRequest() throws Exception {
    loopback.deliver(SipFixtures.options("options-1@pbx", "z9hG4bKopt"));

    var transaction = connection.accept(5, TimeUnit.SECONDS);

    assertNotNull(transaction);
    assertEquals(Request.OPTIONS, transaction.getMethod());
  }

  @Test
  public void testAcceptTimesOutWithoutRequest() throws Exception {
    assertNull(connection.accept(100, TimeUnit.MILLISECONDS));
  }

  @Test
  public void testMalformedFramesAreSkipped() throws Exception {
    loopback.deliver("this is not sip\r\n\r\n");
    loopback.deliver("");
    loopback.deliver(SipFixtures.options("options-2@pbx", "z9hG4bKafter"));

    var transaction = connection.accept(5, TimeUnit.SECONDS);

    assertEquals("options-2@pbx", transaction.getCallId().getCallId());
    assertTrue(connection.isOpen());
  }

  @Test
  public void testResponseWrittenBeforeSendReturnsIsNotLost() throws Exception {
    // The peer answers while the request is still being written
    loopback.onSend(text -> loopback.deliver(SipFixtures.response(text, 200, "OK")));

    var transaction = connection.dialog().request(Request.OPTIONS).send();

    var response = assertTimeoutPreemptively(Duration.ofSeconds(5), transaction::receive);
    assertEquals(200, response.getStatusCode());
  }

  @Test
  public void testResponsesAreRoutedToTheirTransaction() throws Exception {
    var dialog = connection.dialog();
    var first = dialog.request(Request.OPTIONS).send();
    var second = dialog.request(Request.OPTIONS).send();
    var firstFrame = loopback.nextSent();
    var secondFrame = loopback.nextSent();

    loopback.deliver(SipFixtures.response(secondFrame, 486, "Busy Here"));
    loopback.deliver(SipFixtures.response(firstFrame, 200, "OK"));

    assertEquals(200, assertTimeoutPreemptively(Duration.ofSeconds(5), first::receive).getStatusCode());
    assertEquals(486, assertTimeoutPreemptively(Duration.ofSeconds(5), second::receive).getStatusCode());
    assertEquals(0, connection.transactions().size());
  }

  @Test
  public void testInviteThenCancel() throws Exception {
    loopback.deliver(SipFixtures.invite("call-42@pbx", 12, "z9hG4bKinvite"));
    var invite = connection.accept(5, TimeUnit.SECONDS);
    invite.respond(Response.TRYING).send();
    invite.respond(Response.RINGING).send();

    loopback.deliver(SipFixtures.cancel("call-42@pbx", 12, "z9hG4bKinvite"));
    var cancel = connection.accept(5, TimeUnit.SECONDS);
    assertEquals(Request.CANCEL, cancel.getMethod());
    cancel.respond(Response.ACCEPTED).send();

    var trying = loopback.nextSent();
    var ringing = loopback.nextSent();
    var accepted = loopback.nextSent();

    assertTrue(trying.startsWith("SIP/2.0 100 "));
    assertTrue(ringing.startsWith("SIP/2.0 180 "));
    assertTrue(accepted.startsWith("SIP/2.0 202 "));
    assertEquals("12 INVITE", SipFixtures.header(trying, "CSeq"));
    assertEquals("12 INVITE", SipFixtures.header(ringing, "CSeq"));
    assertEquals("12 CANCEL", SipFixtures.header(accepted, "CSeq"));
    for (String frame : new String[] {trying, ringing, accepted}) {
      assertEquals("call-42@pbx", SipFixtures.header(frame, "Call-ID"));
      assertTrue(SipFixtures.header(frame, "Via").contains("branch=z9hG4bKinvite"));
    }
    var parsed = SipFixtures.parseResponse(accepted);
    assertEquals(12, ((CSeqHeader) parsed.getHeader(CSeqHeader.NAME)).getSeqNumber());
  }

  @Test
  public void testCloseEndsAccept() throws Exception {
    connection.close();

    var e = assertThrows(TransportClosedException.class, connection::accept);
    assertEquals("client closed connection", e.getMessage());
    awaitClosed();
  }

  @Test
  public void testPeerHangUpEndsAcceptAndPendingTransactions() throws Exception {
    var transaction = connection.dialog().request(Request.OPTIONS).send();
    loopback.nextSent();

    loopback.hangUp();

    assertThrows(TransportClosedException.class, () -> connection.accept(5, TimeUnit.SECONDS));
    assertThrows(TransportClosedException.class, transaction::receive);
    awaitClosed();
  }

  @Test
  public void testTransportErrorClosesConnection() throws Exception {
    loopback.fail(new IOException("reset by peer"));

    assertThrows(TransportClosedException.class, connection::accept);
    awaitClosed();
  }

  @Test
  public void testWriteFailureClosesPendingTransactions() throws Exception {
    loopback.failWrites();

    var transaction = connection.dialog().request(Request.OPTIONS).send();

    assertThrows(TransportClosedException.class, transaction::receive);
    awaitClosed();
  }

  @Test
  public void testSendAfterCloseFails() throws Exception {
    connection.close();

    assertThrows(TransportClosedException.class, () -> connection.dialog().request(Request.OPTIONS).send());
    assertEquals(0, connection.transactions().size());
  }

  @Test
  public void testRespondAfterCloseFails() throws Exception {
    loopback.deliver(SipFixtures.options("options-3@pbx", "z9hG4bKlate"));
    var transaction = connection.accept(5, TimeUnit.SECONDS);

    connection.close();

    assertThrows(TransportClosedException.class, () -> transaction.respond(Response.OK).send());
  }

  @Test
  public void testBurstOfRequestsDoesNotBlockResponders() throws Exception {
    var count = 25;
    var peer = new Thread(() -> {
      for (int i = 0; i < count; i++) {
        loopback.deliver(SipFixtures.options("burst-" + i + "@pbx", "z9hG4bKburst" + i));
      }
    });
    peer.start();
    Thread.sleep(500);

    var answered = assertTimeoutPreemptively(Duration.ofSeconds(10), () -> {
      int n = 0;
      while (n < count) {
        connection.accept().respond(Response.ACCEPTED).send();
        n++;
      }
      return n;
    });
    peer.join(5000);

    assertEquals(count, answered);
    for (int i = 0; i < count; i++) {
      var frame = loopback.nextSent();
      assertTrue(frame.startsWith("SIP/2.0 202 "), frame);
      assertEquals("burst-" + i + "@pbx", SipFixtures.header(frame, "Call-ID"));
    }
    assertTrue(connection.isOpen());
  }

  private void sendAndAbandon() throws Exception {
    connection.dialog().request(Request.OPTIONS).send();
  }

  @Test
  public void testAbandonedTransactionIsDeregistered() throws Exception {
    sendAndAbandon();
    loopback.nextSent();

    for (int i = 0; i < 100 && connection.transactions().size() > 0; i++) {
      System.gc();
      Thread.sleep(20);
    }

    assertEquals(0, connection.transactions().size());
  }
}
