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
package io.ucware.client;

import io.ucware.sipsocket.Connection;
import io.ucware.sipsocket.ServerTransaction;
import io.ucware.sipsocket.TransportClosedException;
import io.ucware.sipsocket.utils.MessageCodec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sip.message.Request;
import javax.sip.message.Response;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class CallNotifierTest {
  private final List<Response> sent = new ArrayList<>();

  @Mock
  private Notifier notifier;

  @Mock
  private Notifier.Notification notification;

  private ServerTransaction transaction(final String method, final long cseq, final String from)
      throws Exception {
    var text = method + " sip:u1000@pbx.example.com SIP/2.0\r\n"
        + "Via: SIP/2.0/WSS 10.0.0.1:8089;branch=z9hG4bK" + method.toLowerCase() + cseq + "\r\n"
        + "From: " + from + ";tag=abc\r\n"
        + "To: <sip:u1000@pbx.example.com>\r\n"
        + "Call-ID: notify@pbx\r\n"
        + "CSeq: " + cseq + " " + method + "\r\n"
        + "Content-Length: 0\r\n\r\n";
    return new ServerTransaction((Request) MessageCodec.decode(text), sent::add);
  }

  private List<Integer> statusCodes() {
    var codes = new ArrayList<Integer>();
    for (Response response : sent) {
      codes.add(response.getStatusCode());
    }
    return codes;
  }

  @Test
  public void testOptionsIsAccepted() throws Exception {
    new CallNotifier(notifier).handle(transaction(Request.OPTIONS, 1, "<sip:pbx.example.com>"));

    assertEquals(List.of(202), statusCodes());
    verifyNoInteractions(notifier);
  }

  @Test
  public void testInviteRingsAndNotifies() throws Exception {
    when(notifier.show(CallNotifier.SUMMARY, "Bob Builder")).thenReturn(notification);
    var callNotifier = new CallNotifier(notifier);

    callNotifier.handle(transaction(Request.INVITE, 12, "\"Bob Builder\" <sip:bob@pbx.example.com>"));

    assertEquals(List.of(100, 180), statusCodes());
    assertEquals(1, callNotifier.pending());
    verify(notification, never()).close();
  }

  @Test
  public void testInviteWithoutDisplayNameShowsUnknown() throws Exception {
    when(notifier.show(CallNotifier.SUMMARY, CallNotifier.UNKNOWN_CALLER)).thenReturn(notification);

    new CallNotifier(notifier).handle(transaction(Request.INVITE, 3, "<sip:bob@pbx.example.com>"));

    verify(notifier).show(CallNotifier.SUMMARY, "Unknown");
  }

  @Test
  public void testCancelClosesMatchingNotification() throws Exception {
    when(notifier.show(anyString(), anyString())).thenReturn(notification);
    var callNotifier = new CallNotifier(notifier);
    callNotifier.handle(transaction(Request.INVITE, 12, "\"Bob Builder\" <sip:bob@pbx.example.com>"));

    callNotifier.handle(transaction(Request.CANCEL, 12, "\"Bob Builder\" <sip:bob@pbx.example.com>"));

    assertEquals(List.of(100, 180, 202), statusCodes());
    verify(notification).close();
    assertEquals(0, callNotifier.pending());
  }

  @Test
  public void testCancelForOtherCallKeepsNotification() throws Exception {
    when(notifier.show(anyString(), anyString())).thenReturn(notification);
    var callNotifier = new CallNotifier(notifier);
    callNotifier.handle(transaction(Request.INVITE, 12, "\"Bob Builder\" <sip:bob@pbx.example.com>"));

    callNotifier.handle(transaction(Request.CANCEL, 13, "\"Bob Builder\" <sip:bob@pbx.example.com>"));

    assertEquals(List.of(100, 180, 202), statusCodes());
    verify(notification, never()).close();
    assertEquals(1, callNotifier.pending());
  }

  @Test
  public void testOtherMethodsAreIgnored() throws Exception {
    new CallNotifier(notifier).handle(transaction(Request.BYE, 4, "<sip:bob@pbx.example.com>"));

    assertTrue(sent.isEmpty());
    verifyNoInteractions(notifier);
  }

  @Test
  public void testRunEndsWhenConnectionCloses() throws Exception {
    var connection = mock(Connection.class);
    when(connection.accept())
        .thenReturn(transaction(Request.OPTIONS, 1, "<sip:pbx.example.com>"))
        .thenThrow(new TransportClosedException("client closed connection"));

    var e = assertThrows(TransportClosedException.class, () -> new CallNotifier(notifier).run(connection));

    assertEquals("client closed connection", e.getMessage());
    assertEquals(List.of(202), statusCodes());
  }
}
