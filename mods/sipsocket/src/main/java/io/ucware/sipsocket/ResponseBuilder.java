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

import gov.nist.javax.sip.message.SIPResponse;

import javax.sip.SipException;
import javax.sip.header.ContentTypeHeader;
import javax.sip.header.Header;
import javax.sip.message.Response;
import java.text.ParseException;
import java.util.List;

/**
 * Assembles a SIP/2.0 response for a {@link ServerTransaction} and hands it to the connection.
 */
public final class ResponseBuilder {
  private final ResponseSink sink;
  private final int statusCode;
  private final List<Header> headers;

  ResponseBuilder(final ResponseSink sink, final int statusCode, final List<Header> headers) {
    this.sink = sink;
    this.statusCode = statusCode;
    this.headers = headers;
  }

  public ResponseBuilder header(final Header header) {
    headers.add(header);
    return this;
  }

  public Response build() throws SipSocketException {
    return build(null, null);
  }

  /**
   * Sends the response without a body.
   *
   * @throws SipSocketException if the response cannot be assembled or the connection is closed
   * @throws InterruptedException if interrupted while waiting for the connection to take it
   */
  public void send() throws SipSocketException, InterruptedException {
    sink.send(build());
  }

  public void send(final ContentTypeHeader contentType, final byte[] body)
      throws SipSocketException, InterruptedException {
    sink.send(build(contentType, body));
  }

  private Response build(final ContentTypeHeader contentType, final byte[] body) throws SipSocketException {
    var response = new SIPResponse();
    try {
      response.setStatusCode(statusCode);
      response.setReasonPhrase(SIPResponse.getReasonPhrase(statusCode));
      for (Header header : headers) {
        response.addLast(header);
      }
      if (body != null && body.length > 0) {
        response.setContent(body, contentType);
      }
    } catch (ParseException | SipException e) {
      throw new SipSocketException("unable to build " + statusCode + " response", e);
    }
    return response;
  }
}
