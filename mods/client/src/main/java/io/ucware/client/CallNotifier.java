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
import io.ucware.sipsocket.SipSocketException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sip.message.Request;
import javax.sip.message.Response;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Announces incoming calls: rings back on INVITE, shows a notification for the caller and closes
 * it again when the call is cancelled. Notifications are keyed by the CSeq number, which an INVITE
 * and its CANCEL share.
 */
public class CallNotifier {
  private static final Logger LOG = LogManager.getLogger(CallNotifier.class);
  static final String SUMMARY = "Incoming Call";
  static final String UNKNOWN_CALLER = "Unknown";

  private final Notifier notifier;
  private final Map<Long, Notifier.Notification> notifications = new ConcurrentHashMap<>();

  public CallNotifier(final Notifier notifier) {
    this.notifier = notifier;
  }

  /**
   * Handles inbound requests until the connection closes.
   *
   * @param connection The registered connection
   * @throws SipSocketException when the connection closes or a request cannot be answered
   * @throws InterruptedException if interrupted while waiting
   */
  public void run(final Connection connection) throws SipSocketException, InterruptedException {
    while (true) {
      handle(connection.accept());
    }
  }

  void handle(final ServerTransaction transaction) throws SipSocketException, InterruptedException {
    switch (transaction.getMethod()) {
      case Request.OPTIONS:
        transaction.respond(Response.ACCEPTED).send();
        break;
      case Request.INVITE:
        onInvite(transaction);
        break;
      case Request.CANCEL:
        onCancel(transaction);
        break;
      default:
        LOG.debug("ignoring {} request", transaction.getMethod());
    }
  }

  private void onInvite(final ServerTransaction transaction) throws SipSocketException, InterruptedException {
    var from = transaction.getFrom();
    var seq = transaction.getCSeq().getSeqNumber();

    transaction.respond(Response.TRYING).send();
    transaction.respond(Response.RINGING).send();

    var displayName = from.getAddress().getDisplayName();
    var caller = displayName == null || displayName.isEmpty() ? UNKNOWN_CALLER : displayName;
    LOG.info("incoming call from {}", caller);

    var previous = notifications.put(seq, notifier.show(SUMMARY, caller));
    if (previous != null) {
      previous.close();
    }
  }

  private void onCancel(final ServerTransaction transaction) throws SipSocketException, InterruptedException {
    var seq = transaction.getCSeq().getSeqNumber();

    transaction.respond(Response.ACCEPTED).send();

    var notification = notifications.remove(seq);
    if (notification != null) {
      LOG.info("call {} cancelled", seq);
      notification.close();
    }
  }

  int pending() {
    return notifications.size();
  }
}
