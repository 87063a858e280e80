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
package io.ucware.client.rpc;

import java.net.URI;

/**
 * The JSON-RPC interfaces the client talks to, each served under {@code <namespace>/<interface>/}.
 */
public enum RpcEndpoint {
  USER_AUTHENTICATION("user", "authentication"),
  USER_SLOT("user", "slot");

  private final String namespace;
  private final String iface;

  RpcEndpoint(final String namespace, final String iface) {
    this.namespace = namespace;
    this.iface = iface;
  }

  public String getNamespace() {
    return namespace;
  }

  public String getInterface() {
    return iface;
  }

  /**
   * @param baseUrl The API base URL, ending in a slash
   * @return The URL requests to this interface are posted to
   */
  public URI resolve(final URI baseUrl) {
    return baseUrl.resolve(namespace + "/").resolve(iface + "/");
  }
}
