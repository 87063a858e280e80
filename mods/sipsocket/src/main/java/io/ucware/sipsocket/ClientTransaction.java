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

import io.ucware.sipsocket.utils.BoundedChannel;
import io.ucware.sipsocket.utils.ResponseHelper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sip.message.Request;
import javax.sip.message.Response;
import java.lang.ref.Cleaner;
import java.lang.ref.WeakReference;

/**
 * A transaction as seen from the client, the participant that sent the request.
 *
 * <p>The handle holds its registry weakly: it never keeps a connection alive, and once the
 * connection is gone deregistration quietly does nothing. Closing the handle, returning from
 * {@link #receive()} or letting the handle become unreachable all deregister it, after which a
 * late response is treated as unmatched.
 */
public final class ClientTransaction implements AutoCloseable {
  private static final Logger LOG = LogManager.getLogger(ClientTransaction.class);
  private static final Cleaner CLEANER = Cleaner.create();

  private final Request request;
  private final TransactionKey key;
  private final BoundedChannel<Response> responses;
  private final Cleaner.Cleanable deregistration;

  ClientTransaction(final Request request, final BoundedChannel<Response> responses,
      final TransactionRegistry registry) {
    this.request = request;
    this.key = TransactionKey.fromRequest(request);
    this.responses = responses;
    this.deregistration = CLEANER.register(this,
        new Deregistration(new WeakReference<>(registry), key, responses));
  }

  public Request getRequest() {
    return request;
  }

  public TransactionKey getKey() {
    return key;
  }

  /**
   * Waits for the final response, skipping provisional ones.
   *
   * @return The first non-provisional response
   * @throws TransportClosedException if the transaction ended before a final response arrived
   * @throws InterruptedException if interrupted while waiting
   */
  public Response receive() throws TransportClosedException, InterruptedException {
    try {
      while (true) {
        var response = responses.receive();
        if (response == null) {
          throw new TransportClosedException("transaction closed without response");
        }

        if (ResponseHelper.isProvisional(response)) {
          LOG.trace("skipping provisional response {} for {}", response.getStatusCode(), key);
          continue;
        }

        return response;
      }
    } finally {
      close();
    }
  }

  @Override
  public void close() {
    deregistration.clean();
  }

  /** Must not reference the transaction, or the cleaner would never run. */
  private static final class Deregistration implements Runnable {
    private final WeakReference<TransactionRegistry> registry;
    private final TransactionKey key;
    private final BoundedChannel<Response> responses;

    Deregistration(final WeakReference<TransactionRegistry> registry, final TransactionKey key,
        final BoundedChannel<Response> responses) {
      this.registry = registry;
      this.key = key;
      this.responses = responses;
    }

    @Override
    public void run() {
      var transactions = registry.get();
      if (transactions == null) {
        responses.close();
        return;
      }
      transactions.deregister(key, responses);
    }
  }
}
