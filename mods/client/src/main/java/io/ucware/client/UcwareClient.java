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

import com.fasterxml.jackson.databind.JavaType;
import io.ucware.client.rpc.RpcClient;
import io.ucware.client.rpc.RpcEndpoint;
import io.ucware.client.rpc.RpcException;
import io.ucware.sipsocket.Connection;
import io.ucware.sipsocket.SipSocketException;
import io.ucware.sipsocket.transport.TransportConnector;
import io.ucware.sipsocket.transport.WebSocketTransport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.util.List;

/**
 * Client of a UCware server's JSON-RPC API, and the entry point for its SIP socket.
 */
public class UcwareClient {
  private static final Logger LOG = LogManager.getLogger(UcwareClient.class);
  static final String API_PATH = "api/2/";

  private final URI url;
  private final TokenStore tokens;
  private final RpcClient rpc;

  public UcwareClient(final URI baseUrl, final TokenStore tokens) {
    this.url = normalize(baseUrl);
    this.tokens = tokens;
    this.rpc = new RpcClient(url, tokens::get);
  }

  UcwareClient(final URI baseUrl, final TokenStore tokens, final RpcClient rpc) {
    this.url = normalize(baseUrl);
    this.tokens = tokens;
    this.rpc = rpc;
  }

  /**
   * Appends {@code /api/2/} to the path unless it already ends with it.
   */
  static URI normalize(final URI baseUrl) {
    var path = baseUrl.getRawPath() == null || baseUrl.getRawPath().isEmpty() ? "/" : baseUrl.getRawPath();
    if (!path.endsWith("/")) {
      path = path + "/";
    }
    if (!path.endsWith("/" + API_PATH)) {
      path = path + API_PATH;
    }
    return baseUrl.resolve(path);
  }

  public URI getUrl() {
    return url;
  }

  /**
   * Exchanges the current token for a fresh one and stores it.
   */
  public void refreshToken() throws RpcException, IOException, InterruptedException {
    var token = rpc.call(RpcEndpoint.USER_AUTHENTICATION, "getToken", String.class);
    tokens.update(token);
    LOG.info("token refreshed");
  }

  public String validateToken() throws RpcException, InterruptedException {
    return rpc.call(RpcEndpoint.USER_AUTHENTICATION, "validateToken", String.class);
  }

  public List<Slot> slots() throws RpcException, InterruptedException {
    JavaType type = rpc.getMapper().getTypeFactory().constructCollectionType(List.class, Slot.class);
    return rpc.call(RpcEndpoint.USER_SLOT, "getAll", type);
  }

  public Connection socket() throws RpcException, SipSocketException, IOException, InterruptedException {
    return socket(WebSocketTransport::connect);
  }

  /**
   * Opens a SIP socket on the user's WebRTC slot and registers it.
   *
   * @param connector Opens the underlying transport
   * @return The registered connection
   * @throws IllegalStateException if the user has no WebRTC slot
   */
  public Connection socket(final TransportConnector connector)
      throws RpcException, SipSocketException, IOException, InterruptedException {
    var slot = slots().stream()
        .filter(Slot::isWebRtc)
        .findFirst()
        .orElseThrow(() -> new IllegalStateException("no matching slot found"));
    LOG.debug("using slot {}", slot);

    var connection = Connection.connect(socketUrl(slot), slot.getSipUser(), connector);
    try {
      connection.register(slot.getSipUser(), slot.getSipPassword());
    } catch (SipSocketException | InterruptedException e) {
      connection.close();
      throw e;
    }
    return connection;
  }

  URI socketUrl(final Slot slot) {
    return URI.create("wss://" + url.getHost() + ":" + slot.getSipPort() + "/sipsockets/");
  }
}
