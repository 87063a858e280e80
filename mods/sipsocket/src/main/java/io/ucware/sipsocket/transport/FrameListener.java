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

import java.nio.ByteBuffer;

/**
 * The read side of a transport: receives inbound frames in arrival order.
 */
public interface FrameListener {

  void onText(String text);

  void onPing(ByteBuffer payload);

  void onClose(int statusCode, String reason);

  void onError(Throwable error);
}
