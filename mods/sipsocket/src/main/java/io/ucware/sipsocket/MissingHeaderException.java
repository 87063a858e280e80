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

/**
 * A message lacks a header the requested operation depends on.
 */
public class MissingHeaderException extends SipSocketException {
  private final String headerName;

  public MissingHeaderException(final String headerName) {
    super("no '" + headerName + "' header received");
    this.headerName = headerName;
  }

  public String getHeaderName() {
    return headerName;
  }
}
