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

import java.net.URI;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Process configuration, taken from environment variables.
 */
public final class ClientConfig {
  static final String URL_ENV = "UCWARE_URL";
  static final String TOKEN_ENV = "UCWARE_TOKEN";
  static final String TOKEN_FILE_ENV = "UCWARE_TOKEN_FILE";
  static final String DEFAULT_TOKEN_FILE = ".token";

  private final URI url;
  private final String token;
  private final Path tokenFile;

  private ClientConfig(final URI url, final String token, final Path tokenFile) {
    this.url = url;
    this.token = token;
    this.tokenFile = tokenFile;
  }

  public static ClientConfig fromEnvironment() {
    return from(System.getenv());
  }

  static ClientConfig from(final Map<String, String> env) {
    String urlEnv = env.get(URL_ENV);
    String tokenEnv = env.get(TOKEN_ENV);
    String tokenFileEnv = env.get(TOKEN_FILE_ENV);

    if (urlEnv == null || urlEnv.isBlank()) {
      throw new IllegalStateException(URL_ENV + " is not set");
    }

    URI url;
    try {
      url = URI.create(urlEnv.trim());
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException(URL_ENV + " is not a valid URL: " + urlEnv, e);
    }
    if (url.getHost() == null) {
      throw new IllegalStateException(URL_ENV + " has no host: " + urlEnv);
    }

    var token = tokenEnv == null || tokenEnv.isBlank() ? null : tokenEnv.trim();
    var tokenFile = Path.of(tokenFileEnv == null || tokenFileEnv.isBlank() ? DEFAULT_TOKEN_FILE : tokenFileEnv);
    return new ClientConfig(url, token, tokenFile);
  }

  public URI getUrl() {
    return url;
  }

  public Optional<String> getToken() {
    return Optional.ofNullable(token);
  }

  public Path getTokenFile() {
    return tokenFile;
  }
}
