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

import io.ucware.sipsocket.utils.DigestCalculator;
import io.ucware.sipsocket.utils.MessageCodec;
import io.ucware.sipsocket.utils.Randoms;
import io.ucware.sipsocket.utils.ResponseHelper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sip.InvalidArgumentException;
import javax.sip.header.AuthorizationHeader;
import javax.sip.header.ContactHeader;
import javax.sip.header.WWWAuthenticateHeader;
import javax.sip.message.Request;
import javax.sip.message.Response;
import java.text.ParseException;

/**
 * REGISTER with digest authentication, in at most two rounds on one dialog.
 *
 * <p>The first REGISTER carries no credentials. A 401 challenge is answered by a second REGISTER
 * on the same dialog (same Call-ID, next CSeq) with a Contact binding and an Authorization
 * header. Quality of protection is not supported: qop is never sent, even when offered.
 */
final class Registration {
  private static final Logger LOG = LogManager.getLogger(Registration.class);
  static final int CONTACT_EXPIRES = 6000;
  static final String CONTACT_TRANSPORT = "ws";
  private static final String DIGEST_SCHEME = "Digest";
  // Digest URI left empty, as the registrar expects
  private static final String DIGEST_URI = "";

  private final Connection connection;

  Registration(final Connection connection) {
    this.connection = connection;
  }

  void register(final String username, final String password) throws SipSocketException, InterruptedException {
    var dialog = connection.dialog();

    var response = dialog.request(Request.REGISTER).send().receive();
    if (ResponseHelper.isSuccess(response)) {
      LOG.info("registered {} without challenge", connection.getUser());
      return;
    }

    if (response.getStatusCode() != Response.UNAUTHORIZED) {
      throw new RegistrationException(response.getStatusCode());
    }

    var challenge = (WWWAuthenticateHeader) response.getHeader(WWWAuthenticateHeader.NAME);
    if (challenge == null) {
      throw new MissingHeaderException(WWWAuthenticateHeader.NAME);
    }
    LOG.debug("got challenge for realm {}", challenge.getRealm());

    response = dialog.request(Request.REGISTER)
        .header(contact())
        .header(authorization(challenge, username, password))
        .send()
        .receive();

    if (!ResponseHelper.isSuccess(response)) {
      throw new RegistrationException(response.getStatusCode());
    }
    LOG.info("registered {}", connection.getUser());
  }

  private ContactHeader contact() throws SipSocketException {
    var addressFactory = MessageCodec.addressFactory();
    try {
      var uri = addressFactory.createSipURI(Randoms.alphanumeric(16), connection.getSendBy());
      uri.setTransportParam(CONTACT_TRANSPORT);

      var contact = MessageCodec.headerFactory().createContactHeader(addressFactory.createAddress(uri));
      contact.setExpires(CONTACT_EXPIRES);
      return contact;
    } catch (ParseException | InvalidArgumentException e) {
      throw new SipSocketException("unable to create contact header", e);
    }
  }

  private AuthorizationHeader authorization(final WWWAuthenticateHeader challenge, final String username,
      final String password) throws SipSocketException {
    if (challenge.getScheme() != null && !DIGEST_SCHEME.equalsIgnoreCase(challenge.getScheme())) {
      throw new RegistrationException(Response.UNAUTHORIZED,
          "unsupported authentication scheme: " + challenge.getScheme());
    }

    var algorithm = challenge.getAlgorithm();
    if (!DigestCalculator.isSupported(algorithm)) {
      throw new RegistrationException(Response.UNAUTHORIZED, "unsupported digest algorithm: " + algorithm);
    }

    var realm = challenge.getRealm();
    var nonce = challenge.getNonce();
    var digest = DigestCalculator.compute(algorithm, username, realm, password, Request.REGISTER, DIGEST_URI, nonce);

    try {
      var authorization = MessageCodec.headerFactory().createAuthorizationHeader(DIGEST_SCHEME);
      authorization.setUsername(username);
      authorization.setRealm(realm);
      authorization.setNonce(nonce);
      authorization.setParameter("uri", DIGEST_URI);
      authorization.setResponse(digest);
      if (algorithm != null) {
        authorization.setAlgorithm(algorithm);
      }
      if (challenge.getOpaque() != null) {
        authorization.setOpaque(challenge.getOpaque());
      }
      return authorization;
    } catch (ParseException e) {
      throw new SipSocketException("unable to create authorization header", e);
    }
  }
}
