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
import io.ucware.sipsocket.utils.Randoms;
import io.ucware.sipsocket.utils.UserAgent;

import javax.sip.InvalidArgumentException;
import javax.sip.address.Address;
import javax.sip.header.UserAgentHeader;
import java.text.ParseException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A Call-ID and a CSeq counter shared by a sequence of requests on one connection.
 *
 * <p>Every request taken from a dialog gets the next sequence number, whatever its method, so
 * CSeq values are strictly increasing and never reused.
 */
public final class Dialog {
  static final String BRANCH_MAGIC_COOKIE = "z9hG4bK";
  static final String VIA_TRANSPORT = "WSS";

  private final Connection connection;
  private final String callId;
  private final AtomicLong sequence;

  Dialog(final Connection connection, final String callId, final long firstSequence) {
    this.connection = connection;
    this.callId = callId;
    this.sequence = new AtomicLong(firstSequence);
  }

  public String getCallId() {
    return callId;
  }

  /**
   * Starts a request seeded with Via, To, From, CSeq, Call-ID and User-Agent. To and From both
   * name the local user of the connection.
   *
   * @param method The request method
   * @return A builder to add headers to and send the request with
   * @throws SipSocketException if the headers cannot be created
   */
  public RequestBuilder request(final String method) throws SipSocketException {
    var headerFactory = MessageCodec.headerFactory();
    var addressFactory = MessageCodec.addressFactory();

    try {
      var requestUri = addressFactory.createSipURI(null, connection.getDomain());
      var user = addressFactory.createAddress(connection.getUser());
      var branch = BRANCH_MAGIC_COOKIE + Randoms.alphanumeric(16);

      return new RequestBuilder(connection, method, requestUri)
          .header(headerFactory.createViaHeader(connection.getSendBy(), -1, VIA_TRANSPORT, branch))
          .header(headerFactory.createToHeader(user, null))
          .header(headerFactory.createFromHeader((Address) user.clone(), null))
          .header(headerFactory.createCSeqHeader(sequence.getAndIncrement(), method))
          .header(headerFactory.createCallIdHeader(callId))
          .header(headerFactory.createHeader(UserAgentHeader.NAME, UserAgent.value()));
    } catch (ParseException | InvalidArgumentException e) {
      throw new SipSocketException("unable to create " + method + " request", e);
    }
  }
}
