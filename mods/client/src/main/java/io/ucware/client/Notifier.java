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

/**
 * Shows call notifications to the user.
 */
public interface Notifier {

  /**
   * Shows a notification that stays until closed.
   *
   * @param summary The headline
   * @param body The detail text
   * @return A handle to close the notification with
   */
  Notification show(String summary, String body);

  /**
   * A notification on display.
   */
  @FunctionalInterface
  interface Notification {
    void close();
  }
}
