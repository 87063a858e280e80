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
package io.ucware.sipsocket.transport;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * The write side of a frame-oriented transport. Only the connection's multiplexer calls it, so
 * implementations need not be thread safe.
 */
public interface Transport {

  /**
   * Writes one complete text frame.
   *
   * @param text The frame payload
   * @throws IOException if the frame could not be written
   */
  void sendText(String text) throws IOException;

  /**
   * Answers a ping.
   *
   * @param payload The payload of the ping being answered
   * @throws IOException if the frame could not be written
   */
  void sendPong(ByteBuffer payload) throws IOException;

  /**
   * Closes the transport. Safe to call more than once.
   */
  void close();
}
