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

/**
 * A JSON-RPC call failed, either with an error object from the server or at the HTTP level.
 */
public class RpcException extends Exception {
  private final int code;

  public RpcException(final int code, final String message) {
    super(message);
    this.code = code;
  }

  public RpcException(final String message, final Throwable cause) {
    super(message, cause);
    this.code = 0;
  }

  /**
   * @return The JSON-RPC error code, the HTTP status for transport failures, or 0
   */
  public int getCode() {
    return code;
  }
}
