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
package io.ucware.client.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

public class RpcClientTest {
  private final ObjectMapper mapper = new ObjectMapper();
  private final Map<String, JsonNode> requests = new ConcurrentHashMap<>();
  private final Map<String, String> authorizations = new ConcurrentHashMap<>();
  private HttpServer server;
  private RpcClient client;

  @BeforeEach
  public void setUp() throws Exception {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext("/api/2/user/authentication/", exchange -> {
      var request = record(exchange);
      switch (request.get("method").asText()) {
        case "getToken":
          reply(exchange, 200, "{\"jsonrpc\":\"2.0\",\"id\":" + request.get("id") + ",\"result\":\"fresh\"}");
          break;
        default:
          reply(exchange, 200, "{\"jsonrpc\":\"2.0\",\"id\":" + request.get("id")
              + ",\"error\":{\"code\":-32601,\"message\":\"Method not found\"}}");
      }
    });
    server.createContext("/api/2/user/slot/", exchange -> {
      var request = record(exchange);
      reply(exchange, 200, "{\"jsonrpc\":\"2.0\",\"id\":" + request.get("id") + ",\"result\":[\"a\",\"b\"]}");
    });
    server.createContext("/api/2/broken/", exchange -> reply(exchange, 502, "bad gateway"));
    server.start();

    var base = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/api/2/");
    client = new RpcClient(base, () -> "t0k3n");
  }

  @AfterEach
  public void tearDown() {
    server.stop(0);
  }

  private JsonNode record(final HttpExchange exchange) throws IOException {
    var body = mapper.readTree(exchange.getRequestBody().readAllBytes());
    requests.put(body.get("method").asText(), body);
    authorizations.put(body.get("method").asText(), exchange.getRequestHeaders().getFirst("Authorization"));
    return body;
  }

  private static void reply(final HttpExchange exchange, final int status, final String body) throws IOException {
    var bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders().add("Content-Type", "application/json");
    exchange.sendResponseHeaders(status, bytes.length);
    exchange.getResponseBody().write(bytes);
    exchange.close();
  }

  @Test
  public void testCallReturnsResult() throws Exception {
    assertEquals("fresh", client.call(RpcEndpoint.USER_AUTHENTICATION, "getToken", String.class));

    var request = requests.get("getToken");
    assertEquals("2.0", request.get("jsonrpc").asText());
    assertTrue(request.get("params").isArray());
    assertEquals(0, request.get("params").size());
    assertTrue(request.has("id"));
    assertEquals("Bearer t0k3n", authorizations.get("getToken"));
  }

  @Test
  public void testCallMapsGenericResult() throws Exception {
    var type = mapper.getTypeFactory().constructCollectionType(List.class, String.class);

    List<String> result = client.call(RpcEndpoint.USER_SLOT, "getAll", type);

    assertEquals(List.of("a", "b"), result);
  }

  @Test
  public void testErrorObjectBecomesException() {
    var e = assertThrows(RpcException.class,
        () -> client.call(RpcEndpoint.USER_AUTHENTICATION, "validateToken", String.class));

    assertEquals(-32601, e.getCode());
    assertEquals("Method not found", e.getMessage());
  }

  @Test
  public void testHttpFailureBecomesException() {
    var base = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/api/2/broken/");
    var broken = new RpcClient(base, () -> "t0k3n");

    var e = assertThrows(RpcException.class, () -> broken.call(RpcEndpoint.USER_SLOT, "getAll", String.class));
    assertEquals(502, e.getCode());
  }
}
