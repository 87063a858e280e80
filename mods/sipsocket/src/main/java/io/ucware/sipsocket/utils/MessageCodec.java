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
package io.ucware.sipsocket.utils;

import io.ucware.sipsocket.MalformedMessageException;

import javax.sip.PeerUnavailableException;
import javax.sip.SipFactory;
import javax.sip.address.AddressFactory;
import javax.sip.header.HeaderFactory;
import javax.sip.message.Message;
import javax.sip.message.MessageFactory;
import java.text.ParseException;

/**
 * Access to the JAIN-SIP factories and the text form of SIP messages carried in WebSocket frames.
 */
public final class MessageCodec {
  private static final String RESPONSE_PREFIX = "SIP/";

  private static final MessageFactory MESSAGE_FACTORY;
  private static final HeaderFactory HEADER_FACTORY;
  private static final AddressFactory ADDRESS_FACTORY;

  static {
    try {
      SipFactory sipFactory = SipFactory.getInstance();
      MESSAGE_FACTORY = sipFactory.createMessageFactory();
      HEADER_FACTORY = sipFactory.createHeaderFactory();
      ADDRESS_FACTORY = sipFactory.createAddressFactory();
    } catch (PeerUnavailableException e) {
      throw new IllegalStateException("jain-sip implementation not available", e);
    }
  }

  private MessageCodec() {
  }

  public static MessageFactory messageFactory() {
    return MESSAGE_FACTORY;
  }

  public static HeaderFactory headerFactory() {
    return HEADER_FACTORY;
  }

  public static AddressFactory addressFactory() {
    return ADDRESS_FACTORY;
  }

  /**
   * Parses the content of one text frame.
   *
   * @param text The frame payload
   * @return A {@link javax.sip.message.Request} or a {@link javax.sip.message.Response}
   * @throws MalformedMessageException if the text is not a SIP message
   */
  public static Message decode(final String text) throws MalformedMessageException {
    try {
      if (text.startsWith(RESPONSE_PREFIX)) {
        return MESSAGE_FACTORY.createResponse(text);
      }
      return MESSAGE_FACTORY.createRequest(text);
    } catch (ParseException | RuntimeException e) {
      throw new MalformedMessageException("unable to parse sip message", e);
    }
  }

  public static String encode(final Message message) {
    return message.toString();
  }
}
