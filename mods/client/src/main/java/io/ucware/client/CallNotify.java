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
package io.ucware.client;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/**
 * The call-notify program: registers the user's WebRTC slot and announces incoming calls.
 */
public class CallNotify {
  private static final Logger LOG = LogManager.getLogger(CallNotify.class);

  public static void main(final String[] args) {
    try {
      run(ClientConfig.fromEnvironment(), new LoggingNotifier());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOG.warn("interrupted");
      System.exit(1);
    } catch (Exception e) {
      LOG.fatal("call-notify failed: {}", e.getMessage(), e);
      System.exit(1);
    }
  }

  static void run(final ClientConfig config, final Notifier notifier) throws Exception {
    var tokens = openTokens(config);
    var client = new UcwareClient(config.getUrl(), tokens);
    client.refreshToken();

    try (var connection = client.socket()) {
      new CallNotifier(notifier).run(connection);
    }
  }

  static TokenStore openTokens(final ClientConfig config) throws IOException {
    var token = config.getToken();
    if (token.isPresent()) {
      return TokenStore.withToken(config.getTokenFile(), token.get());
    }
    return TokenStore.open(config.getTokenFile())
        .orElseThrow(() -> new IllegalStateException("no token specified and no store available"));
  }
}
