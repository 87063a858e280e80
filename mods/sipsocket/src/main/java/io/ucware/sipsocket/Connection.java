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

import io.ucware.sipsocket.transport.TransportConnector;
import io.ucware.sipsocket.transport.WebSocketTransport;
import io.ucware.sipsocket.utils.BoundedChannel;
import io.ucware.sipsocket.utils.MessageCodec;
import io.ucware.sipsocket.utils.Randoms;
import io.ucware.sipsocket.utils.ThreadExceptionHandler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sip.address.SipURI;
import javax.sip.message.Request;
import javax.sip.message.Response;
import java.io.IOException;
import java.net.URI;
import java.text.ParseException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A SIP user agent signaling over one WebSocket.
 *
 * <p>The transport is owned by a dedicated multiplexer thread; everything here talks to it through
 * bounded queues and may be called from any thread. Requests received from the peer are taken with
 * {@link #accept()}, requests to the peer are started with {@link #dialog()} or {@link #send}.
 */
public final class Connection implements AutoCloseable {
  private static final Logger LOG = LogManager.getLogger(Connection.class);
  private static final AtomicInteger SEQUENCE = new AtomicInteger();
  private static final String PLACEHOLDER_DOMAIN = ".invalid";

  private final URI url;
  private final SipURI user;
  private final String sendBy;
  private final Multiplexer multiplexer;
  private final TransactionRegistry transactions;

  private Connection(final URI url, final SipURI user, final String sendBy, final Multiplexer multiplexer,
      final TransactionRegistry transactions) {
    this.url = url;
    this.user = user;
    this.sendBy = sendBy;
    this.multiplexer = multiplexer;
    this.transactions = transactions;
  }

  /**
   * Opens a SIP over WebSocket connection.
   *
   * @param url The {@code wss://} endpoint; its host is the SIP domain
   * @param username The user part of the local SIP identity
   * @return The open connection
   * @throws IOException if the WebSocket handshake fails
   * @throws InterruptedException if interrupted during the handshake
   */
  public static Connection connect(final URI url, final String username) throws IOException, InterruptedException {
    return connect(url, username, WebSocketTransport::connect);
  }

  public static Connection connect(final URI url, final String username, final TransportConnector connector)
      throws IOException, InterruptedException {
    LOG.info("connecting to: {}", url);

    var domain = domainOf(url);
    SipURI user;
    try {
      user = MessageCodec.addressFactory().createSipURI(username, domain);
    } catch (ParseException e) {
      throw new IllegalArgumentException("invalid sip user: " + username + "@" + domain, e);
    }

    // Never resolved: the registrar only needs a consistent Via/Contact host for a relayed socket
    var sendBy = Randoms.alphanumeric(16) + PLACEHOLDER_DOMAIN;
    var name = "sipsocket-" + SEQUENCE.incrementAndGet();

    var transactions = new TransactionRegistry();
    var multiplexer = new Multiplexer(name, transactions);
    multiplexer.attach(connector.connect(url, multiplexer));

    var thread = new Thread(multiplexer, name);
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler(new ThreadExceptionHandler());
    thread.start();

    LOG.debug("connection {} up as {} (send-by {})", name, user, sendBy);
    return new Connection(url, user, sendBy, multiplexer, transactions);
  }

  public URI getUrl() {
    return url;
  }

  /**
   * @return The host part of the endpoint URL, used as SIP domain
   */
  public String getDomain() {
    return user.getHost();
  }

  /**
   * @return The local identity, {@code sip:<username>@<domain>}
   */
  public SipURI getUser() {
    return (SipURI) user.clone();
  }

  /**
   * @return The placeholder host used in Via and Contact headers
   */
  public String getSendBy() {
    return sendBy;
  }

  public boolean isOpen() {
    return multiplexer.isRunning();
  }

  /**
   * Waits for the next request the peer sent.
   *
   * @return A transaction to respond to
   * @throws TransportClosedException once the connection is closed
   * @throws InterruptedException if interrupted while waiting
   */
  public ServerTransaction accept() throws TransportClosedException, InterruptedException {
    return next(multiplexer.inbound().receive());
  }

  /**
   * Waits at most the given time for the next request the peer sent.
   *
   * @return A transaction to respond to, or null if none arrived in time
   * @throws TransportClosedException once the connection is closed
   * @throws InterruptedException if interrupted while waiting
   */
  public ServerTransaction accept(final long timeout, final TimeUnit unit)
      throws TransportClosedException, InterruptedException {
    var inbound = multiplexer.inbound();
    var transaction = inbound.poll(timeout, unit);
    if (transaction == null && !inbound.isClosed()) {
      return null;
    }
    return next(transaction);
  }

  /**
   * Starts a client transaction. The transaction is registered before the request is queued for
   * transmission, so even an immediate response finds it.
   *
   * @param request The request to send
   * @return The transaction that receives the responses
   * @throws TransportClosedException if the connection is closed
   * @throws InterruptedException if interrupted while waiting for room in the outgoing queue
   */
  public ClientTransaction send(final Request request) throws TransportClosedException, InterruptedException {
    BoundedChannel<Response> responses = BoundedChannel.unbounded();
    var transaction = new ClientTransaction(request, responses, transactions);

    LOG.trace("register transaction with: {}", transaction.getKey());
    transactions.register(transaction.getKey(), responses);

    if (!multiplexer.submit(request)) {
      transaction.close();
      throw new TransportClosedException("client closed connection");
    }
    return transaction;
  }

  /**
   * Starts a dialog with a fresh random Call-ID and a random first sequence number.
   *
   * @return The dialog
   */
  public Dialog dialog() {
    return new Dialog(this, Randoms.alphanumeric(16), Randoms.sequenceStart());
  }

  /**
   * Registers the local user with the registrar, answering its digest challenge.
   *
   * @param username The user name to authenticate as
   * @param password The password
   * @throws SipSocketException if the registration fails
   * @throws InterruptedException if interrupted while waiting for the registrar
   */
  public void register(final String username, final String password) throws SipSocketException, InterruptedException {
    new Registration(this).register(username, password);
  }

  @Override
  public void close() {
    multiplexer.shutdown();
  }

  TransactionRegistry transactions() {
    return transactions;
  }

  private static ServerTransaction next(final ServerTransaction transaction) throws TransportClosedException {
    if (transaction == null) {
      throw new TransportClosedException("client closed connection");
    }
    return transaction;
  }

  private static String domainOf(final URI url) {
    var host = url.getHost();
    if (host == null || host.isEmpty()) {
      throw new IllegalArgumentException("URL must have a domain: " + url);
    }
    return host;
  }
}
