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

import io.ucware.sipsocket.utils.MessageCodec;
import io.ucware.sipsocket.utils.UserAgent;

import javax.sip.header.CSeqHeader;
import javax.sip.header.CallIdHeader;
import javax.sip.header.FromHeader;
import javax.sip.header.Header;
import javax.sip.header.ToHeader;
import javax.sip.header.UserAgentHeader;
import javax.sip.header.ViaHeader;
import javax.sip.message.Request;
import java.text.ParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.ListIterator;

/**
 * A transaction as seen from the server, the participant that received the request.
 *
 * <p>Nothing is retained once a response is handed over; there is no retransmission.
 */
public final class ServerTransaction {
  private static final String[] CORRELATION_HEADERS = {
      ViaHeader.NAME, FromHeader.NAME, ToHeader.NAME, CSeqHeader.NAME, CallIdHeader.NAME
  };

  private final Request request;
  private final ResponseSink responses;

  public ServerTransaction(final Request request, final ResponseSink responses) {
    this.request = request;
    this.responses = responses;
  }

  public Request getRequest() {
    return request;
  }

  public String getMethod() {
    return request.getMethod();
  }

  public CSeqHeader getCSeq() throws MissingHeaderException {
    return required(CSeqHeader.NAME);
  }

  public FromHeader getFrom() throws MissingHeaderException {
    return required(FromHeader.NAME);
  }

  public CallIdHeader getCallId() throws MissingHeaderException {
    return required(CallIdHeader.NAME);
  }

  /**
   * Starts a response carrying copies of exactly the Via, From, To, CSeq and Call-ID headers of
   * the request, followed by a User-Agent header.
   *
   * @param statusCode The status code of the response
   * @return A builder that transmits the response on {@link ResponseBuilder#send()}
   * @throws MissingHeaderException if the request lacks one of the copied headers
   */
  public ResponseBuilder respond(final int statusCode) throws MissingHeaderException {
    List<Header> headers = new ArrayList<>();
    for (String name : CORRELATION_HEADERS) {
      ListIterator<?> values = request.getHeaders(name);
      if (values == null || !values.hasNext()) {
        throw new MissingHeaderException(name);
      }
      while (values.hasNext()) {
        headers.add((Header) ((Header) values.next()).clone());
      }
    }

    try {
      headers.add(MessageCodec.headerFactory().createHeader(UserAgentHeader.NAME, UserAgent.value()));
    } catch (ParseException e) {
      throw new IllegalStateException("invalid user agent: " + UserAgent.value(), e);
    }

    return new ResponseBuilder(responses, statusCode, headers);
  }

  @SuppressWarnings("unchecked")
  private <H extends Header> H required(final String name) throws MissingHeaderException {
    var header = request.getHeader(name);
    if (header == null) {
      throw new MissingHeaderException(name);
    }
    return (H) header;
  }
}
