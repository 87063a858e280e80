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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A bearer token kept in memory and mirrored to a file, so a refreshed token survives restarts.
 */
public final class TokenStore {
  private static final Logger LOG = LogManager.getLogger(TokenStore.class);
  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final Path path;
  private String token;

  private TokenStore(final Path path, final String token) {
    this.path = path;
    this.token = token;
  }

  /**
   * Seeds the store with a token, overwriting the file.
   *
   * @param path The token file
   * @param token The token
   * @return The store
   * @throws IOException if the file cannot be written
   */
  public static TokenStore withToken(final Path path, final String token) throws IOException {
    Files.writeString(path, token, StandardCharsets.UTF_8);
    return new TokenStore(path, token);
  }

  /**
   * Loads the token stored by an earlier run.
   *
   * @param path The token file
   * @return The store, or empty if the file does not exist
   * @throws IOException if the file exists but cannot be read
   */
  public static Optional<TokenStore> open(final Path path) throws IOException {
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    LOG.debug("loading existing token from store");
    return Optional.of(new TokenStore(path, Files.readString(path, StandardCharsets.UTF_8).trim()));
  }

  public String get() {
    lock.readLock().lock();
    try {
      return token;
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Replaces the token and rewrites the file, unless the token did not change.
   *
   * @param next The new token
   * @throws IOException if the file cannot be written
   */
  public void update(final String next) throws IOException {
    lock.writeLock().lock();
    try {
      if (next.equals(token)) {
        return;
      }
      token = next;
      Files.writeString(path, next, StandardCharsets.UTF_8);
      LOG.debug("stored refreshed token in {}", path);
    } finally {
      lock.writeLock().unlock();
    }
  }

  public Path getPath() {
    return path;
  }
}
