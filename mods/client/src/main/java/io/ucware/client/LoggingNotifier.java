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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Writes notifications to the log.
 */
public class LoggingNotifier implements Notifier {
  private static final Logger LOG = LogManager.getLogger(LoggingNotifier.class);
  private final AtomicLong ids = new AtomicLong();

  @Override
  public Notification show(final String summary, final String body) {
    var id = ids.incrementAndGet();
    LOG.info("[notification {}] {}: {}", id, summary, body);
    return () -> LOG.info("[notification {}] closed", id);
  }
}
