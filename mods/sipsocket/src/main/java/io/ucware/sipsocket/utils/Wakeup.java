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
package io.ucware.sipsocket.utils;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * Lets one thread sleep until some condition over several {@link BoundedChannel}s holds.
 *
 * <p>Channels report changes through {@link #fire()}; the waiter re-evaluates its condition on
 * every change. The condition is evaluated while this lock is held, so it may take channel locks,
 * but {@link #fire()} must never be called while holding one.
 */
public final class Wakeup {
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();

  public void fire() {
    lock.lock();
    try {
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Blocks until the condition holds.
   *
   * @param ready The condition to wait for
   * @throws InterruptedException if interrupted while waiting
   */
  public void await(final BooleanSupplier ready) throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (!ready.getAsBoolean()) {
        changed.await();
      }
    } finally {
      lock.unlock();
    }
  }
}
