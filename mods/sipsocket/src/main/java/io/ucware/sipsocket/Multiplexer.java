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

import io.ucware.sipsocket.transport.FrameListener;
import io.ucware.sipsocket.transport.Transport;
import io.ucware.sipsocket.utils.BoundedChannel;
import io.ucware.sipsocket.utils.MessageCodec;
import io.ucware.sipsocket.utils.Wakeup;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sip.message.Message;
import javax.sip.message.Request;
import javax.sip.message.Response;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * The single task owning a connection's transport.
 *
 * <p>Work arrives on two lanes: frames from the peer, and requests and responses to write. The
 * lanes are separate so a burst of inbound frames can never keep a responder from queueing its
 * answer. Writes are flushed before the next frame is handled. Inbound requests become
 * {@link ServerTransaction}s on a queue of capacity one; inbound responses are routed through the
 * {@link TransactionRegistry}. When the loop ends, for whatever reason, the inbound queue and every
 * pending transaction are closed.
 */
final class Multiplexer implements FrameListener, Runnable {
  private static final Logger LOG = LogManager.getLogger(Multiplexer.class);
  static final int FRAME_CAPACITY = 16;
  static final int OUTGOING_CAPACITY = 16;

  private final String name;
  private final TransactionRegistry registry;
  private final Wakeup wakeup = new Wakeup();
  private final BoundedChannel<Frame> frames = new BoundedChannel<>(FRAME_CAPACITY, wakeup::fire);
  private final BoundedChannel<Message> outgoing = new BoundedChannel<>(OUTGOING_CAPACITY, wakeup::fire);
  private final BoundedChannel<ServerTransaction> inbound = new BoundedChannel<>(1, wakeup::fire);
  private volatile Transport transport;

  Multiplexer(final String name, final TransactionRegistry registry) {
    this.name = name;
    this.registry = registry;
  }

  void attach(final Transport transport) {
    this.transport = transport;
  }

  BoundedChannel<ServerTransaction> inbound() {
    return inbound;
  }

  boolean isRunning() {
    return !frames.isClosed();
  }

  /**
   * Queues a client-initiated request for transmission.
   *
   * @return False if the connection is closed
   */
  boolean submit(final Request request) throws InterruptedException {
    return outgoing.send(request);
  }

  /**
   * Queues a response to an inbound transaction for transmission.
   */
  void respond(final Response response) throws TransportClosedException, InterruptedException {
    if (!outgoing.send(response)) {
      throw new TransportClosedException("client closed connection");
    }
  }

  /**
   * Asks the loop to stop once it has handled what is already queued.
   */
  void shutdown() {
    outgoing.close();
    frames.close();
  }

  @Override
  public void onText(final String text) {
    post(Frame.text(text));
  }

  @Override
  public void onPing(final ByteBuffer payload) {
    post(Frame.ping(payload));
  }

  @Override
  public void onClose(final int statusCode, final String reason) {
    post(Frame.closed(statusCode + " " + reason));
  }

  @Override
  public void onError(final Throwable error) {
    post(Frame.failed(error));
  }

  @Override
  public void run() {
    LOG.debug("multiplexer {} started", name);
    try {
      while (true) {
        wakeup.await(() -> !outgoing.isEmpty() || !frames.isEmpty() || frames.isClosed());
        flush();

        var frame = frames.pollNow();
        if (frame == null) {
          if (frames.isClosed()) {
            break;
          }
          continue;
        }
        if (!dispatch(frame)) {
          break;
        }
      }
    } catch (InterruptedException e) {
      LOG.debug("multiplexer {} interrupted", name);
      Thread.currentThread().interrupt();
    } catch (IOException e) {
      LOG.warn("transport failure on {}; closing connection", name, e);
    } finally {
      terminate();
    }
  }

  private boolean dispatch(final Frame frame) throws IOException, InterruptedException {
    switch (frame.kind) {
      case TEXT:
        LOG.trace("got message from ws: {}", frame.text);
        handleText(frame.text);
        return true;
      case PING:
        transport.sendPong(frame.payload);
        return true;
      case CLOSE:
        LOG.info("connection {} closed by peer ({})", name, frame.text);
        return false;
      case ERROR:
        LOG.warn("transport error on {}; closing connection", name, frame.error);
        return false;
      default:
        throw new IllegalStateException("unknown frame kind: " + frame.kind);
    }
  }

  private void handleText(final String text) throws IOException, InterruptedException {
    if (text.isBlank()) {
      LOG.trace("ignoring keep-alive frame");
      return;
    }

    Message message;
    try {
      message = MessageCodec.decode(text);
    } catch (MalformedMessageException e) {
      LOG.warn("discarding malformed frame on {}: {}", name, e.getCause().getMessage());
      LOG.debug("malformed frame content: {}", text);
      return;
    }

    if (message instanceof Request) {
      // A new request starts a new transaction
      deliver(new ServerTransaction((Request) message, this::respond));
    } else {
      registry.route((Response) message);
    }
  }

  /**
   * Hands a transaction to the consumer. While the consumer is busy, queued writes keep flowing,
   * since the consumer may itself be waiting to respond.
   */
  private void deliver(final ServerTransaction transaction) throws IOException, InterruptedException {
    while (!inbound.offerNow(transaction)) {
      if (inbound.isClosed() || frames.isClosed()) {
        LOG.debug("dropping inbound {} on {}; no consumer left", transaction.getMethod(), name);
        return;
      }
      flush();
      wakeup.await(() -> inbound.isEmpty() || !outgoing.isEmpty() || inbound.isClosed() || frames.isClosed());
    }
  }

  private void flush() throws IOException {
    Message message;
    while ((message = outgoing.pollNow()) != null) {
      LOG.trace("outgoing {}: {}", message instanceof Request ? "request" : "response", message);
      transport.sendText(MessageCodec.encode(message));
    }
  }

  private void post(final Frame frame) {
    try {
      if (!frames.send(frame)) {
        LOG.trace("connection {} closed; dropping {} frame", name, frame.kind);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOG.debug("interrupted while queueing {} frame on {}", frame.kind, name);
    }
  }

  private void terminate() {
    frames.close();
    outgoing.close();
    inbound.close();
    registry.close();
    if (transport != null) {
      transport.close();
    }
    LOG.info("connection {} closed", name);
  }

  enum Kind {
    TEXT, PING, CLOSE, ERROR
  }

  private static final class Frame {
    private final Kind kind;
    private final String text;
    private final ByteBuffer payload;
    private final Throwable error;

    private Frame(final Kind kind, final String text, final ByteBuffer payload, final Throwable error) {
      this.kind = kind;
      this.text = text;
      this.payload = payload;
      this.error = error;
    }

    static Frame text(final String text) {
      return new Frame(Kind.TEXT, text, null, null);
    }

    static Frame ping(final ByteBuffer payload) {
      return new Frame(Kind.PING, null, payload, null);
    }

    static Frame closed(final String reason) {
      return new Frame(Kind.CLOSE, reason, null, null);
    }

    static Frame failed(final Throwable error) {
      return new Frame(Kind.ERROR, null, null, error);
    }
  }
}
