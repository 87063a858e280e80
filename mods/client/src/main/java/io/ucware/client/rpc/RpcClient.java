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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * JSON-RPC 2.0 over HTTP POST, authenticated with a bearer token.
 */
public class RpcClient {
  private static final Logger LOG = LogManager.getLogger(RpcClient.class);
  private static final String JSONRPC_VERSION = "2.0";
  private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

  private final URI baseUrl;
  private final Supplier<String> token;
  private final HttpClient http;
  private final ObjectMapper mapper;
  private final AtomicLong ids = new AtomicLong();

  public RpcClient(final URI baseUrl, final Supplier<String> token) {
    this(baseUrl, token, HttpClient.newBuilder().connectTimeout(REQUEST_TIMEOUT).build(), new ObjectMapper());
  }

  public RpcClient(final URI baseUrl, final Supplier<String> token, final HttpClient http,
      final ObjectMapper mapper) {
    this.baseUrl = baseUrl;
    this.token = token;
    this.http = http;
    this.mapper = mapper;
  }

  public ObjectMapper getMapper() {
    return mapper;
  }

  public <T> T call(final RpcEndpoint endpoint, final String method, final Class<T> resultType)
      throws RpcException, InterruptedException {
    return call(endpoint, method, mapper.getTypeFactory().constructType(resultType));
  }

  /**
   * Invokes a method without parameters.
   *
   * @param endpoint The interface the method belongs to
   * @param method The method name
   * @param resultType The type to map the result member to
   * @return The mapped result
   * @throws RpcException if the server answers with an error or the call fails
   * @throws InterruptedException if interrupted while waiting for the server
   */
  public <T> T call(final RpcEndpoint endpoint, final String method, final JavaType resultType)
      throws RpcException, InterruptedException {
    var url = endpoint.resolve(baseUrl);
    var id = ids.incrementAndGet();

    ObjectNode body = mapper.createObjectNode();
    body.put("jsonrpc", JSONRPC_VERSION);
    body.put("id", id);
    body.put("method", method);
    body.putArray("params");

    HttpResponse<String> response;
    try {
      var request = HttpRequest.newBuilder(url)
          .timeout(REQUEST_TIMEOUT)
          .header("Content-Type", "application/json")
          .header("Authorization", "Bearer " + token.get())
          .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
          .build();
      LOG.debug("calling {} at {}", method, url);
      response = http.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new RpcException("request to " + url + " failed", e);
    }

    if (response.statusCode() / 100 != 2) {
      throw new RpcException(response.statusCode(), "unexpected http status " + response.statusCode() + " from " + url);
    }

    JsonNode reply;
    try {
      reply = mapper.readTree(response.body());
    } catch (JsonProcessingException e) {
      throw new RpcException("invalid response from " + url, e);
    }

    var error = reply.get("error");
    if (error != null && !error.isNull()) {
      var code = error.path("code").asInt();
      var message = error.path("message").asText("unknown error");
      LOG.warn("{} failed with code {}: {}", method, code, message);
      throw new RpcException(code, message);
    }
    if (!reply.has("result")) {
      throw new RpcException(0, "response to " + method + " has no result");
    }

    try {
      return mapper.convertValue(reply.get("result"), resultType);
    } catch (IllegalArgumentException e) {
      throw new RpcException("unexpected result of " + method, e);
    }
  }
}
