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
package io.ucware.sipsocket.transport;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * SIP over WebSocket (RFC 7118) on top of {@code java.net.http}.
 *
 * <p>Each SIP message travels as one text frame. Partial deliveries are reassembled before they
 * reach the listener, and a new frame is only requested once the previous one was handed over,
 * so a slow listener throttles the socket.
 */
public final class WebSocketTransport implements Transport, WebSocket.Listener {
  private static final Logger LOG = LogManager.getLogger(WebSocketTransport.class);
  public static final String SUBPROTOCOL = "sip";
  private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

  private final FrameListener frames;
  private final StringBuilder partial = new StringBuilder();
  private volatile WebSocket webSocket;

  private WebSocketTransport(final FrameListener frames) {
    this.frames = frames;
  }

  /**
   * Performs the opening handshake, requesting the {@value #SUBPROTOCOL} subprotocol.
   *
   * @param uri The {@code wss://} endpoint
   * @param frames Receives inbound frames
   * @return The open transport
   * @throws IOException if the handshake fails
   * @throws InterruptedException if interrupted during the handshake
   */
  public static Transport connect(final URI uri, final FrameListener frames)
      throws IOException, InterruptedException {
    var transport = new WebSocketTransport(frames);
    try {
      HttpClient.newHttpClient()
          .newWebSocketBuilder()
          .subprotocols(SUBPROTOCOL)
          .connectTimeout(CONNECT_TIMEOUT)
          .buildAsync(uri, transport)
          .get();
    } catch (ExecutionException e) {
      throw new IOException("websocket handshake with " + uri + " failed", e.getCause());
    }
    return transport;
  }

  @Override
  public void sendText(final String text) throws IOException {
    await(webSocket.sendText(text, true));
  }

  @Override
  public void sendPong(final ByteBuffer payload) {
    // java.net.http answers every ping by itself
    LOG.trace("ping of {} bytes already answered by the websocket client", payload.remaining());
  }

  @Override
  public void close() {
    var ws = webSocket;
    if (ws == null || ws.isOutputClosed()) {
      return;
    }
    ws.sendClose(WebSocket.NORMAL_CLOSURE, "").whenComplete((result, error) -> {
      if (error != null) {
        LOG.debug("websocket close handshake failed; aborting", error);
      }
      ws.abort();
    });
  }

  @Override
  public void onOpen(final WebSocket webSocket) {
    this.webSocket = webSocket;
    LOG.debug("websocket open, subprotocol = {}", webSocket.getSubprotocol());
    webSocket.request(1);
  }

  @Override
  public CompletionStage<?> onText(final WebSocket webSocket, final CharSequence data, final boolean last) {
    partial.append(data);
    if (last) {
      var text = partial.toString();
      partial.setLength(0);
      frames.onText(text);
    }
    webSocket.request(1);
    return null;
  }

  @Override
  public CompletionStage<?> onBinary(final WebSocket webSocket, final ByteBuffer data, final boolean last) {
    LOG.debug("ignoring binary frame of {} bytes", data.remaining());
    webSocket.request(1);
    return null;
  }

  @Override
  public CompletionStage<?> onPing(final WebSocket webSocket, final ByteBuffer message) {
    var payload = ByteBuffer.allocate(message.remaining()).put(message).flip();
    frames.onPing(payload);
    webSocket.request(1);
    return null;
  }

  @Override
  public CompletionStage<?> onClose(final WebSocket webSocket, final int statusCode, final String reason) {
    frames.onClose(statusCode, reason);
    return null;
  }

  @Override
  public void onError(final WebSocket webSocket, final Throwable error) {
    frames.onError(error);
  }

  private static void await(final CompletableFuture<WebSocket> future) throws IOException {
    try {
      future.get();
    } catch (ExecutionException e) {
      throw new IOException("websocket write failed", e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException("interrupted while writing to websocket", e);
    }
  }
}
