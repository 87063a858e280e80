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

import javax.sip.message.Response;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Pending client transactions of one connection, keyed by {@link TransactionKey}.
 *
 * <p>Written by senders registering new transactions, by the multiplexer routing responses and by
 * transaction teardown; all three may run concurrently.
 */
public class TransactionRegistry {
  private static final Logger LOG = LogManager.getLogger(TransactionRegistry.class);
  private final ConcurrentMap<TransactionKey, BoundedChannel<Response>> pending = new ConcurrentHashMap<>();
  private volatile boolean closed;

  /**
   * Registers the channel that receives the responses for a key. A pending entry under the same
   * key is replaced and its channel closed, so the transaction owning it ends without response.
   *
   * @param key The transaction key
   * @param responses The response channel of the transaction
   */
  public void register(final TransactionKey key, final BoundedChannel<Response> responses) {
    var previous = pending.put(key, responses);
    if (previous != null && previous != responses) {
      LOG.warn("duplicate transaction {}; replacing the pending one", key);
      previous.close();
    }

    // close() may have swept the map before our put landed
    if (closed) {
      deregister(key, responses);
    }
  }

  /**
   * Delivers a response to the transaction it belongs to. A final response also retires the entry.
   *
   * @param response The response
   * @return True if a pending transaction took the response
   */
  public boolean route(final Response response) {
    var key = TransactionKey.fromResponse(response);
    var responses = pending.get(key);

    if (responses == null || !responses.offerNow(response)) {
      LOG.warn("received response without matching transaction: {} {}", response.getStatusCode(), key);
      return false;
    }

    if (!ResponseHelper.isProvisional(response)) {
      deregister(key, responses);
    }
    return true;
  }

  /**
   * Removes the entry for a key whatever channel it holds. Removing an absent key does nothing.
   *
   * @param key The transaction key
   */
  public void deregister(final TransactionKey key) {
    var responses = pending.remove(key);
    if (responses != null) {
      responses.close();
    }
  }

  /**
   * Removes the entry for a key only while it still holds the given channel.
   *
   * @param key The transaction key
   * @param responses The channel registered for it
   */
  public void deregister(final TransactionKey key, final BoundedChannel<Response> responses) {
    if (pending.remove(key, responses)) {
      LOG.debug("transaction {} deregistered", key);
    }
    responses.close();
  }

  public boolean isPending(final TransactionKey key) {
    return pending.containsKey(key);
  }

  public int size() {
    return pending.size();
  }

  /**
   * Ends every pending transaction without response and refuses later registrations.
   */
  public void close() {
    closed = true;
    for (var key : pending.keySet()) {
      deregister(key);
    }
  }
}
