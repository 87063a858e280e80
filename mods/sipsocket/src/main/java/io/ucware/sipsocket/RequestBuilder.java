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

import gov.nist.javax.sip.message.SIPRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sip.SipException;
import javax.sip.address.URI;
import javax.sip.header.ContentTypeHeader;
import javax.sip.header.Header;
import javax.sip.message.Request;
import java.text.ParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Assembles a request of a {@link Dialog} and sends it through the dialog's connection.
 */
public final class RequestBuilder {
  private static final Logger LOG = LogManager.getLogger(RequestBuilder.class);
  private final Connection connection;
  private final String method;
  private final URI requestUri;
  private final List<Header> headers = new ArrayList<>();

  RequestBuilder(final Connection connection, final String method, final URI requestUri) {
    this.connection = connection;
    this.method = method;
    this.requestUri = requestUri;
  }

  public RequestBuilder header(final Header header) {
    headers.add(header);
    return this;
  }

  public Request build() throws SipSocketException {
    return build(null, null);
  }

  /**
   * Sends the request without a body.
   *
   * @return The transaction that will receive the responses
   * @throws SipSocketException if the request cannot be assembled or the connection is closed
   * @throws InterruptedException if interrupted while waiting for the connection to take it
   */
  public ClientTransaction send() throws SipSocketException, InterruptedException {
    return send(build());
  }

  public ClientTransaction send(final ContentTypeHeader contentType, final byte[] body)
      throws SipSocketException, InterruptedException {
    return send(build(contentType, body));
  }

  private ClientTransaction send(final Request request) throws SipSocketException, InterruptedException {
    LOG.trace("sending request: {}", request);
    return connection.send(request);
  }

  private Request build(final ContentTypeHeader contentType, final byte[] body) throws SipSocketException {
    var request = new SIPRequest();
    try {
      request.setMethod(method);
      request.setRequestURI(requestUri);
      for (Header header : headers) {
        request.addLast(header);
      }
      if (body != null && body.length > 0) {
        request.setContent(body, contentType);
      }
    } catch (ParseException | SipException e) {
      throw new SipSocketException("unable to build " + method + " request", e);
    }
    return request;
  }
}
